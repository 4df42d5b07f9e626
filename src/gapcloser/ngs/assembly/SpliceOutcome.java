package gapcloser.ngs.assembly;

/**
 * What happened to one side of the gap in one iteration. Everything other than
 * {@link #APPLIED} leaves the reference unchanged for that side.
 */
public enum SpliceOutcome {
	APPLIED,
	/** No anchor reads near the boundary. */
	EMPTY_EVIDENCE,
	/** Boundary depth above the ceiling; the side was not attempted. */
	HIGH_COVERAGE,
	/** Not enough sequence between the gap and the reference end to slice anchors. */
	FLANK_TOO_SHORT,
	/** The flank anchor does not occur in the consensus. */
	ANCHOR_NOT_IN_CONSENSUS,
	/** The proposed extension is shorter than the minimum. */
	SHORT_EXTENSION,
	/** The splice target does not occur exactly once in the reference. */
	AMBIGUOUS_ANCHOR,
	/** The splice would merge the gap run with placeholder bases of the extension. */
	GAP_DISRUPTED;

	public boolean applied() {
		return this==APPLIED;
	}
}
