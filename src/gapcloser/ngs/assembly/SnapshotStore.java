package gapcloser.ngs.assembly;

import java.util.List;

/**
 * Keeps one reference snapshot per iteration, for audit and for resuming an
 * interrupted run from its last committed iteration.
 */
public interface SnapshotStore {

	void save(Snapshot snapshot);

	/** The snapshot with the highest iteration number, <tt>null</tt> if none. */
	Snapshot latest();

	/** All snapshots in iteration order. */
	List<Snapshot> snapshots();
}
