package gapcloser.ngs.assembly;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.external.Collaborators;
import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.CoverageProfile;
import gapcloser.ngs.model.HaplotypeBin;
import gapcloser.ngs.model.PhasedAlignments;
import gapcloser.ngs.model.Sequence;
import gapcloser.ngs.model.VariantCalls;

/**
 * Turns the extended reference into the delivered sequence(s): joins the two sides,
 * realigns the reads and writes called variants into the sequence. On the
 * heterozygous path reads are phased and each haplotype is corrected and
 * coverage-masked on its own; when phasing cannot split the reads a single
 * sequence is produced as on the homozygous path.
 */
public class CorrectionStage {

	private final static Logger myLogger = LogManager.getLogger(CorrectionStage.class);

	private final Collaborators collaborators;
	private final PloidyMode mode;
	private final GapJoiner joiner = new GapJoiner();
	private final CoverageMasker masker = new CoverageMasker();

	public CorrectionStage(Collaborators collaborators, PloidyMode mode) {
		this.collaborators = collaborators;
		this.mode = mode;
	}

	/**
	 * @return one corrected sequence named <tt>sample</tt>, or on the heterozygous
	 * path one per haplotype named <tt>sample.bin</tt>
	 */
	public List<Sequence> correct(Sequence extended, String sample) {
		final Sequence reference = joiner.join(extended).rename(sample);
		final String label = "final";

		AlignmentSet alignments = collaborators.aligner().align(reference, label);
		alignments = collaborators.processor().markDuplicates(reference, alignments, label);
		alignments = collaborators.processor().realignIndels(reference, alignments, label);

		final List<Sequence> corrected = new ArrayList<Sequence>();
		if(this.mode==PloidyMode.HOMOZYGOUS) {
			corrected.add(this.render(reference, alignments, label));
			return corrected;
		}

		final CoverageProfile coverage = collaborators.coverage().coverage(reference, alignments, label);
		alignments = ExtensionLoop.downsample(collaborators.processor(), alignments, coverage, label);
		final PhasedAlignments phased = collaborators.phaser().phase(reference, alignments, label);
		if(!phased.isSeparated()) {
			myLogger.info(sample+": reads could not be phased, writing a single sequence");
			AlignmentSet all = phased.get(HaplotypeBin.UNSEPARATED);
			corrected.add(this.render(reference, all==null ? alignments : all, label));
			return corrected;
		}

		for(Map.Entry<HaplotypeBin, AlignmentSet> entry : phased.bins().entrySet()) {
			final HaplotypeBin bin = entry.getKey();
			final AlignmentSet binAlignments = entry.getValue();
			if(binAlignments.isEmpty()) continue;
			final String binLabel = label+".bin"+bin.label();
			Sequence rendered = this.render(reference, binAlignments, binLabel);
			CoverageProfile binCoverage = collaborators.coverage().coverage(reference, binAlignments, binLabel);
			Sequence masked = masker.mask(rendered, binCoverage).rename(sample+"."+bin.label());
			myLogger.info(masked.seq_sn()+": "+binAlignments.size()+" reads, mean depth "+
					String.format("%.2f", binCoverage.mean()));
			corrected.add(masked);
		}
		return corrected;
	}

	private Sequence render(Sequence reference, AlignmentSet alignments, String label) {
		VariantCalls calls = collaborators.caller().call(reference, alignments, label);
		return collaborators.caller().apply(reference, calls, label).rename(reference.seq_sn());
	}
}
