package gapcloser.ngs.assembly;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public class MemorySnapshotStore implements SnapshotStore {

	private final TreeMap<Integer, Snapshot> snapshots = new TreeMap<Integer, Snapshot>();

	@Override
	public void save(Snapshot snapshot) {
		this.snapshots.put(snapshot.iteration(), snapshot);
	}

	@Override
	public Snapshot latest() {
		Map.Entry<Integer, Snapshot> last = this.snapshots.lastEntry();
		return last==null ? null : last.getValue();
	}

	@Override
	public List<Snapshot> snapshots() {
		return new ArrayList<Snapshot>(this.snapshots.values());
	}
}
