package gapcloser.ngs.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.GapRun;
import gapcloser.ngs.model.ReadAlignment;
import gapcloser.ngs.model.Sequence;

public class AnchorExtractorUnitTest {

	private final AnchorExtractor extractor = new AnchorExtractor();
	// left boundary 56, right boundary 76
	private final GapRun gap = new GapRun(60);

	private static ReadAlignment read(String id, int start, int length) {
		return new ReadAlignment(id, StringUtils.repeat('A', length), start);
	}

	private static List<String> ids(List<Sequence> reads) {
		List<String> ids = new ArrayList<String>();
		for(Sequence read : reads) ids.add(read.seq_sn());
		return ids;
	}

	@Test
	public void testLeftWindow() {
		AlignmentSet alignments = new AlignmentSet(Arrays.asList(
				read("boundary", 56, 60),
				read("farthest", 6, 60),
				read("too_far", 5, 60),
				read("short_of_boundary", 30, 20),
				read("reaches_boundary", 37, 20),
				read("past_boundary", 57, 60)));
		Assert.assertEquals(ids(extractor.extract(alignments, gap, Side.LEFT)),
				Arrays.asList("farthest", "reaches_boundary", "boundary"));
	}

	@Test
	public void testRightWindow() {
		AlignmentSet alignments = new AlignmentSet(Arrays.asList(
				read("boundary", 76, 60),
				read("farthest", 26, 10),
				read("too_far", 25, 60),
				read("past_boundary", 77, 60),
				read("farthest_past", 126, 60),
				read("too_far_past", 127, 60)));
		Assert.assertEquals(ids(extractor.extract(alignments, gap, Side.RIGHT)),
				Arrays.asList("farthest", "boundary", "past_boundary", "farthest_past"));
	}

	@Test
	public void testFullReadIsReturned() {
		ReadAlignment clipped = new ReadAlignment("clipped", "ACGTACGTAC", 50, 7, 7);
		List<Sequence> reads = extractor.extract(new AlignmentSet(Arrays.asList(clipped)), gap, Side.LEFT);
		Assert.assertEquals(reads.size(), 1);
		Assert.assertEquals(reads.get(0).seq_str(), "ACGTACGTAC");
	}

	@Test
	public void testNoReads() {
		Assert.assertTrue(extractor.extract(AlignmentSet.empty(), gap, Side.LEFT).isEmpty());
	}
}
