package gapcloser.ngs.assembly;

public enum LoopState {
	RUNNING,
	/** An iteration did not lengthen the reference. */
	STOPPED_NO_GROWTH,
	/** Both boundaries are covered more deeply than the ceiling allows. */
	STOPPED_HIGH_COVERAGE,
	/** Each side's flank now also occurs on the other side: the scaffolds overlap. */
	STOPPED_SIDES_MET,
	/** The iteration budget ran out. */
	STOPPED_MAX_ITERATIONS;

	public boolean isTerminal() {
		return this!=RUNNING;
	}
}
