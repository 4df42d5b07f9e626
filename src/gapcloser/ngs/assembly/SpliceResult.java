package gapcloser.ngs.assembly;

import gapcloser.ngs.model.Sequence;

public class SpliceResult {

	private final SpliceOutcome outcome;
	private final Sequence sequence;
	private final int extension_ln;

	SpliceResult(SpliceOutcome outcome, Sequence sequence, int extension_ln) {
		this.outcome = outcome;
		this.sequence = sequence;
		this.extension_ln = extension_ln;
	}

	static SpliceResult unchanged(SpliceOutcome outcome, Sequence sequence) {
		return new SpliceResult(outcome, sequence, 0);
	}

	public SpliceOutcome outcome() {
		return this.outcome;
	}

	/** The spliced reference, or the input reference when nothing was applied. */
	public Sequence sequence() {
		return this.sequence;
	}

	/** Length of the inserted extension, anchor included; zero when not applied. */
	public int extension_ln() {
		return this.extension_ln;
	}
}
