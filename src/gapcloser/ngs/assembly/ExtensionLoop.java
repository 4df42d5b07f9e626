package gapcloser.ngs.assembly;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Preconditions;

import gapcloser.ngs.external.AlignmentProcessor;
import gapcloser.ngs.external.Collaborators;
import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.CoverageProfile;
import gapcloser.ngs.model.GapRun;
import gapcloser.ngs.model.HaplotypeBin;
import gapcloser.ngs.model.PhasedAlignments;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.ConfigurationException;
import gapcloser.util.Constants;

/**
 * Grows the two scaffolds flanking the gap towards each other, one round of
 * align, select, consensus and splice per iteration, until the reference stops
 * growing, the boundaries are too deeply covered, the two sides overlap or the
 * iteration budget is spent.
 * <p>
 * Iterations are strictly sequential: each one aligns against the reference the
 * previous one committed. Every iteration's reference is handed to the
 * {@link SnapshotStore}, whatever its outcome.
 */
public class ExtensionLoop {

	private final static Logger myLogger = LogManager.getLogger(ExtensionLoop.class);

	private final Collaborators collaborators;
	private final PloidyMode mode;
	private final int maxIterations;
	private final int predictedCoverage;
	private final SnapshotStore store;

	private final AnchorExtractor extractor = new AnchorExtractor();
	private final SpliceEngine splicer = new SpliceEngine();
	private final ConsensusBuilder consensus;

	public ExtensionLoop(Collaborators collaborators,
			PloidyMode mode,
			int maxIterations,
			int predictedCoverage,
			SnapshotStore store) {
		Preconditions.checkArgument(maxIterations>0, "iteration budget must be positive");
		Preconditions.checkArgument(predictedCoverage>0, "predicted coverage must be positive");
		this.collaborators = collaborators;
		this.mode = mode;
		this.maxIterations = maxIterations;
		this.predictedCoverage = predictedCoverage;
		this.store = store;
		this.consensus = new ConsensusBuilder(collaborators.msa());
	}

	/** Boundary depth above which a side is not extended. */
	public int ceiling() {
		return Constants.COVERAGE_CEILING_FACTOR*this.predictedCoverage;
	}

	public LoopResult run(Sequence reference) {
		return this.run(reference, false);
	}

	/**
	 * @param resume start from the latest snapshot in the store, counting its
	 * iterations against the budget
	 */
	public LoopResult run(Sequence reference, boolean resume) {
		Sequence current = reference;
		int iteration = 0;
		if(resume) {
			Snapshot last = this.store.latest();
			if(last!=null) {
				current = last.sequence();
				iteration = last.iteration();
				myLogger.info("Resuming "+current.seq_sn()+" after iteration "+iteration);
			}
		}
		if(current.gapRun()==null)
			throw new ConfigurationException("Reference "+current.seq_sn()+" carries no gap run of "+
					Constants.GAP_LENGTH+" N bases.");

		final List<IterationRecord> records = new ArrayList<IterationRecord>();
		int budget = this.maxIterations-iteration;
		if(budget<=0) {
			myLogger.info("Iteration budget already spent by stored snapshots");
			return new LoopResult(LoopState.STOPPED_MAX_ITERATIONS, current, records, null);
		}

		final int ceiling = this.ceiling();
		LoopState state = LoopState.RUNNING;
		HaplotypeBin bin = null;

		while(state==LoopState.RUNNING) {
			iteration++;
			final String label = "iter"+iteration;

			AlignmentSet alignments = collaborators.aligner().align(current, label);
			if(this.mode==PloidyMode.HETEROZYGOUS) {
				alignments = collaborators.processor().markDuplicates(current, alignments, label);
				alignments = collaborators.processor().realignIndels(current, alignments, label);
			}
			CoverageProfile coverage = collaborators.coverage().coverage(current, alignments, label);
			if(this.mode==PloidyMode.HETEROZYGOUS) {
				alignments = downsample(collaborators.processor(), alignments, coverage, label);
				PhasedAlignments phased = collaborators.phaser().phase(current, alignments, label);
				bin = phased.dominant();
				alignments = phased.get(bin);
				coverage = collaborators.coverage().coverage(current, alignments, label+".bin"+bin.label());
				myLogger.info(label+": extending with haplotype bin "+bin.label()+" ("+alignments.size()+" reads)");
			}

			final GapRun gap = current.gapRun();
			final List<Sequence> left = extractor.extract(alignments, gap, Side.LEFT);
			final List<Sequence> right = extractor.extract(alignments, gap, Side.RIGHT);
			final int leftCoverage = coverage.depth(Side.LEFT.boundary(gap));
			final int rightCoverage = coverage.depth(Side.RIGHT.boundary(gap));

			if(leftCoverage>ceiling && rightCoverage>ceiling) {
				this.store.save(new Snapshot(iteration, current));
				IterationRecord record = new IterationRecord(iteration, gap.position(),
						left.size(), right.size(), leftCoverage, rightCoverage,
						SpliceOutcome.HIGH_COVERAGE, SpliceOutcome.HIGH_COVERAGE, false, current.seq_ln());
				myLogger.info(record);
				records.add(record);
				state = LoopState.STOPPED_HIGH_COVERAGE;
				break;
			}

			Sequence next = current;
			final SpliceOutcome leftOutcome, rightOutcome;
			if(left.isEmpty()) {
				leftOutcome = SpliceOutcome.EMPTY_EVIDENCE;
			} else if(leftCoverage>ceiling) {
				leftOutcome = SpliceOutcome.HIGH_COVERAGE;
			} else {
				SpliceResult result = splicer.splice(next, Side.LEFT, consensus.build(left, label+".left"));
				next = result.sequence();
				leftOutcome = result.outcome();
			}
			if(right.isEmpty()) {
				rightOutcome = SpliceOutcome.EMPTY_EVIDENCE;
			} else if(rightCoverage>ceiling) {
				rightOutcome = SpliceOutcome.HIGH_COVERAGE;
			} else {
				SpliceResult result = splicer.splice(next, Side.RIGHT, consensus.build(right, label+".right"));
				next = result.sequence();
				rightOutcome = result.outcome();
			}
			this.store.save(new Snapshot(iteration, next));

			boolean meetChecked = false;
			if(next.seq_ln()<=current.seq_ln()) {
				state = LoopState.STOPPED_NO_GROWTH;
			} else {
				current = next;
				// only when both sides were attempted this round, a side held back by
				// coverage skips the test even though the reference grew
				if(!left.isEmpty() && !right.isEmpty() &&
						leftOutcome!=SpliceOutcome.HIGH_COVERAGE &&
						rightOutcome!=SpliceOutcome.HIGH_COVERAGE) {
					meetChecked = true;
					if(sidesMet(current)) state = LoopState.STOPPED_SIDES_MET;
				}
				if(state==LoopState.RUNNING && --budget==0)
					state = LoopState.STOPPED_MAX_ITERATIONS;
			}

			IterationRecord record = new IterationRecord(iteration, gap.position(),
					left.size(), right.size(), leftCoverage, rightCoverage,
					leftOutcome, rightOutcome, meetChecked, next.seq_ln());
			myLogger.info(record);
			records.add(record);
		}

		myLogger.info("Extension of "+reference.seq_sn()+" stopped after iteration "+iteration+": "+state+
				", "+reference.seq_ln()+"bp -> "+current.seq_ln()+"bp");
		return new LoopResult(state, current, records, bin);
	}

	/**
	 * True when the {@value gapcloser.util.Constants#MEET_ANCHOR_LENGTH} bases on each
	 * side of the gap each occur at least twice, i.e. each side has grown into the
	 * other's flank.
	 */
	public static boolean sidesMet(Sequence reference) {
		final GapRun gap = reference.gapRun();
		if(gap==null) return false;
		final String left = reference.slice(gap.start()-Constants.MEET_ANCHOR_LENGTH, gap.start());
		final String right = reference.slice(gap.end(), gap.end()+Constants.MEET_ANCHOR_LENGTH);
		if(left==null || right==null) return false;
		return reference.countOccurrences(left)>=2 && reference.countOccurrences(right)>=2;
	}

	/**
	 * Thins alignments whose mean depth exceeds
	 * {@value gapcloser.util.Constants#TARGET_COVERAGE} down to that depth.
	 */
	static AlignmentSet downsample(AlignmentProcessor processor,
			AlignmentSet alignments,
			CoverageProfile coverage,
			String label) {
		final double mean = coverage.mean();
		if(mean<=Constants.TARGET_COVERAGE) return alignments;
		final double fraction = Constants.TARGET_COVERAGE/mean;
		myLogger.info(label+": mean depth "+String.format("%.2f", mean)+
				", downsampling to "+String.format("%.4f", fraction));
		return processor.downsample(alignments, fraction, label);
	}
}
