package gapcloser.ngs.assembly;

import java.util.Collections;
import java.util.List;

import gapcloser.ngs.model.HaplotypeBin;
import gapcloser.ngs.model.Sequence;

public class LoopResult {

	private final LoopState state;
	private final Sequence sequence;
	private final List<IterationRecord> iterations;
	private final HaplotypeBin bin;

	LoopResult(LoopState state, Sequence sequence, List<IterationRecord> iterations, HaplotypeBin bin) {
		this.state = state;
		this.sequence = sequence;
		this.iterations = Collections.unmodifiableList(iterations);
		this.bin = bin;
	}

	public LoopState state() {
		return this.state;
	}

	/** The final reference of the loop. */
	public Sequence sequence() {
		return this.sequence;
	}

	/** Iterations run by this invocation, resumed iterations excluded. */
	public List<IterationRecord> iterations() {
		return this.iterations;
	}

	/**
	 * The haplotype whose reads drove the last iteration; <tt>null</tt> on the
	 * homozygous path.
	 */
	public HaplotypeBin bin() {
		return this.bin;
	}
}
