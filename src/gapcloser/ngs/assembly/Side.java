package gapcloser.ngs.assembly;

import gapcloser.ngs.model.GapRun;

/**
 * The scaffold flanking a gap on one side.
 */
public enum Side {
	LEFT,
	RIGHT;

	/** 1-based boundary coordinate reads are selected and coverage is read at. */
	public int boundary(GapRun gap) {
		return this==LEFT ? gap.leftBoundary() : gap.rightBoundary();
	}
}
