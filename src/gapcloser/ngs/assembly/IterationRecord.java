package gapcloser.ngs.assembly;

/**
 * What one iteration of the extension loop saw and did.
 */
public class IterationRecord {

	private final int iteration;
	private final int gapPosition;
	private final int leftReads;
	private final int rightReads;
	private final int leftCoverage;
	private final int rightCoverage;
	private final SpliceOutcome leftOutcome;
	private final SpliceOutcome rightOutcome;
	private final boolean meetChecked;
	private final int length;

	IterationRecord(int iteration,
			int gapPosition,
			int leftReads,
			int rightReads,
			int leftCoverage,
			int rightCoverage,
			SpliceOutcome leftOutcome,
			SpliceOutcome rightOutcome,
			boolean meetChecked,
			int length) {
		this.iteration = iteration;
		this.gapPosition = gapPosition;
		this.leftReads = leftReads;
		this.rightReads = rightReads;
		this.leftCoverage = leftCoverage;
		this.rightCoverage = rightCoverage;
		this.leftOutcome = leftOutcome;
		this.rightOutcome = rightOutcome;
		this.meetChecked = meetChecked;
		this.length = length;
	}

	public int iteration() {
		return this.iteration;
	}

	/** 1-based position of the gap run at the start of the iteration. */
	public int gapPosition() {
		return this.gapPosition;
	}

	public int leftReads() {
		return this.leftReads;
	}

	public int rightReads() {
		return this.rightReads;
	}

	public int leftCoverage() {
		return this.leftCoverage;
	}

	public int rightCoverage() {
		return this.rightCoverage;
	}

	public SpliceOutcome leftOutcome() {
		return this.leftOutcome;
	}

	public SpliceOutcome rightOutcome() {
		return this.rightOutcome;
	}

	/** Whether the sides-met test was evaluated in this iteration. */
	public boolean meetChecked() {
		return this.meetChecked;
	}

	/** Reference length at the end of the iteration. */
	public int length() {
		return this.length;
	}

	@Override
	public String toString() {
		return "Iteration "+iteration+": gap at "+gapPosition+
				", left "+leftReads+" reads/"+leftCoverage+"x "+leftOutcome+
				", right "+rightReads+" reads/"+rightCoverage+"x "+rightOutcome+
				", length "+length;
	}
}
