package gapcloser.ngs.assembly;

import java.util.Random;

import org.apache.commons.lang3.StringUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import gapcloser.ngs.model.Bases;
import gapcloser.ngs.model.Sequence;

public class SpliceEngineUnitTest {

	private final SpliceEngine splicer = new SpliceEngine();

	private String L, M, R;
	private Sequence reference;

	@BeforeClass
	public void setUp() {
		Random random = new Random(17);
		L = Bases.random(random, 60);
		M = Bases.random(random, 40);
		R = Bases.random(random, 60);
		reference = new Sequence("ref", L+Bases.GAP+R);
	}

	@Test
	public void testLeftSplice() {
		SpliceResult result = splicer.splice(reference, Side.LEFT, L.substring(45)+M);
		Assert.assertEquals(result.outcome(), SpliceOutcome.APPLIED);
		Assert.assertEquals(result.extension_ln(), 55);
		Assert.assertEquals(result.sequence().seq_str(),
				L.substring(0, 45)+(L.substring(45)+M).toLowerCase()+Bases.GAP+R);
		Assert.assertEquals(result.sequence().countGapRuns(), 1);
	}

	@Test
	public void testRightSplice() {
		SpliceResult result = splicer.splice(reference, Side.RIGHT, M+R.substring(0, 15));
		Assert.assertEquals(result.outcome(), SpliceOutcome.APPLIED);
		Assert.assertEquals(result.extension_ln(), 55);
		Assert.assertEquals(result.sequence().seq_str(),
				L+Bases.GAP+(M+R.substring(0, 15)).toLowerCase()+R.substring(15));
	}

	@Test
	public void testLeftExtensionStartsAtFirstAnchor() {
		String anchor = L.substring(45);
		Assert.assertEquals(SpliceEngine.extension("AC"+anchor+"GG"+anchor+"TT", anchor, Side.LEFT),
				(anchor+"GG"+anchor+"TT").toLowerCase());
		Assert.assertEquals(SpliceEngine.extension("AC"+anchor+"GG"+anchor+"TT", anchor, Side.RIGHT),
				("AC"+anchor+"GG"+anchor).toLowerCase());
		Assert.assertNull(SpliceEngine.extension(M, anchor, Side.LEFT));
	}

	@Test
	public void testShortExtension() {
		SpliceResult result = splicer.splice(reference, Side.LEFT, L.substring(45)+M.substring(0, 10));
		Assert.assertEquals(result.outcome(), SpliceOutcome.SHORT_EXTENSION);
		Assert.assertSame(result.sequence(), reference);
	}

	@Test
	public void testAnchorNotInConsensus() {
		SpliceResult result = splicer.splice(reference, Side.LEFT, M+M);
		Assert.assertEquals(result.outcome(), SpliceOutcome.ANCHOR_NOT_IN_CONSENSUS);
		Assert.assertSame(result.sequence(), reference);
	}

	@Test
	public void testEmptyConsensus() {
		Assert.assertEquals(splicer.splice(reference, Side.RIGHT, "").outcome(), SpliceOutcome.EMPTY_EVIDENCE);
	}

	@Test
	public void testFlankTooShort() {
		Sequence shortLeft = new Sequence("ref", "ACGTACGT"+Bases.GAP+R);
		Assert.assertEquals(splicer.splice(shortLeft, Side.LEFT, M).outcome(), SpliceOutcome.FLANK_TOO_SHORT);
		Sequence shortRight = new Sequence("ref", L+Bases.GAP+"ACGTACGT");
		Assert.assertEquals(splicer.splice(shortRight, Side.RIGHT, M).outcome(), SpliceOutcome.FLANK_TOO_SHORT);
	}

	@DataProvider(name = "multiplicity")
	public Object[][] multiplicity() {
		return new Object[][] {{0}, {1}, {2}, {3}};
	}

	@Test(dataProvider = "multiplicity")
	public void testSpliceOnlyAtUniqueTarget(int copies) {
		Sequence repeated = new Sequence("ref", M+StringUtils.repeat(L+Bases.GAP+R, copies));
		String target = L.substring(45)+Bases.GAP+R.substring(0, 10);
		String extension = (L.substring(45)+M).toLowerCase();
		SpliceResult result = splicer.apply(repeated, target, extension, extension+Bases.GAP+R.substring(0, 10));
		if(copies==1) {
			Assert.assertEquals(result.outcome(), SpliceOutcome.APPLIED);
			Assert.assertEquals(result.sequence().seq_str(),
					M+L.substring(0, 45)+extension+Bases.GAP+R);
		} else {
			Assert.assertEquals(result.outcome(), SpliceOutcome.AMBIGUOUS_ANCHOR);
			Assert.assertSame(result.sequence(), repeated);
		}
	}

	@Test
	public void testRepeatedAnchorIsNotSpliced() {
		Sequence repeated = new Sequence("ref", StringUtils.repeat(L+Bases.GAP+R, 2));
		SpliceResult result = splicer.splice(repeated, Side.LEFT, L.substring(45)+M);
		Assert.assertEquals(result.outcome(), SpliceOutcome.AMBIGUOUS_ANCHOR);
		Assert.assertSame(result.sequence(), repeated);
	}

	@Test
	public void testReplacementMustKeepTheGap() {
		String target = L.substring(45)+Bases.GAP+R.substring(0, 10);
		String extension = (L.substring(45)+M).toLowerCase();
		SpliceResult result = splicer.apply(reference, target, extension, extension+R.substring(0, 10));
		Assert.assertEquals(result.outcome(), SpliceOutcome.GAP_DISRUPTED);
		Assert.assertSame(result.sequence(), reference);
	}
}
