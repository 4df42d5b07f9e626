package gapcloser.ngs.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.Range;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.GapRun;
import gapcloser.ngs.model.ReadAlignment;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.Constants;

/**
 * Picks the reads that can extend one side of the gap.
 * <p>
 * Left anchor reads start at most {@code window} bases before the left boundary and
 * reach it. Right anchor reads start within {@code window} bases of the right
 * boundary on either side; those starting before it hang their clipped heads into
 * the gap.
 */
public class AnchorExtractor {

	private final int window;

	public AnchorExtractor() {
		this(Constants.PROXIMITY_WINDOW);
	}

	public AnchorExtractor(int window) {
		this.window = window;
	}

	/**
	 * @return reads as (id, full read sequence), ordered by alignment start; empty if
	 * none qualify
	 */
	public List<Sequence> extract(AlignmentSet alignments, GapRun gap, Side side) {
		final int boundary = side.boundary(gap);
		final Range<Integer> starts = side==Side.LEFT ?
				Range.closed(boundary-window, boundary) :
				Range.closed(boundary-window, boundary+window);
		final List<ReadAlignment> selected = new ArrayList<ReadAlignment>();
		for(ReadAlignment record : alignments.records()) {
			if(!starts.contains(record.start())) continue;
			if(side==Side.LEFT && record.end()<boundary) continue;
			selected.add(record);
		}
		if(selected.isEmpty()) return Collections.emptyList();
		Collections.sort(selected, new ReadAlignment.StartComparator());
		final List<Sequence> reads = new ArrayList<Sequence>(selected.size());
		for(ReadAlignment record : selected)
			reads.add(new Sequence(record.read_id(), record.read_str()));
		return reads;
	}
}
