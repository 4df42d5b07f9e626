package gapcloser.ngs.assembly;

import gapcloser.ngs.model.Sequence;

/**
 * The reference as it stood at the end of an iteration.
 */
public class Snapshot {

	private final int iteration;
	private final Sequence sequence;

	public Snapshot(int iteration, Sequence sequence) {
		this.iteration = iteration;
		this.sequence = sequence;
	}

	public int iteration() {
		return this.iteration;
	}

	public Sequence sequence() {
		return this.sequence;
	}
}
