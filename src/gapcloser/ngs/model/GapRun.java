package gapcloser.ngs.model;

import gapcloser.util.Constants;

/**
 * Location of the gap run in a reference. {@link #start()} is the 0-based index of
 * the first placeholder base, {@link #position()} the same base 1-based, which is
 * the coordinate system alignments and coverage use.
 */
public class GapRun {

	private final int start;
	private final int length;

	public GapRun(int start) {
		this(start, Constants.GAP_LENGTH);
	}

	public GapRun(int start, int length) {
		this.start = start;
		this.length = length;
	}

	public int start() {
		return this.start;
	}

	public int length() {
		return this.length;
	}

	/** Index just past the last placeholder base. */
	public int end() {
		return this.start+this.length;
	}

	public int position() {
		return this.start+1;
	}

	public int leftBoundary() {
		return this.position()-Constants.LEFT_BOUNDARY_OFFSET;
	}

	public int rightBoundary() {
		return this.position()+Constants.RIGHT_BOUNDARY_OFFSET;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof GapRun)) return false;
		GapRun that = (GapRun) o;
		return this.start==that.start && this.length==that.length;
	}

	@Override
	public int hashCode() {
		return 31*this.start+this.length;
	}

	@Override
	public String toString() {
		return "GapRun["+this.position()+"-"+(this.position()+this.length-1)+"]";
	}
}
