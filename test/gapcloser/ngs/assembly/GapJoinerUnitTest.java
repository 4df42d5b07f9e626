package gapcloser.ngs.assembly;

import java.util.Random;

import org.testng.Assert;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import gapcloser.ngs.model.Bases;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.UnresolvableGapException;

public class GapJoinerUnitTest {

	private final GapJoiner joiner = new GapJoiner();
	private String X, Y, Z;

	@BeforeClass
	public void setUp() {
		Random random = new Random(5);
		X = Bases.random(random, 60);
		Y = Bases.random(random, 60);
		Z = Bases.random(random, 30);
	}

	@Test
	public void testRightFlankFoundOnTheLeft() {
		String overlap = X.substring(30);
		Sequence joined = joiner.join(new Sequence("s", X+Bases.GAP+overlap.toLowerCase()+Y));
		Assert.assertTrue(joined.seq_str().equalsIgnoreCase(X+Y));
		Assert.assertEquals(joined.seq_sn(), "s");
		Assert.assertNull(joined.gapRun());
	}

	@Test
	public void testLeftFlankFoundOnTheRight() {
		Sequence joined = joiner.join(new Sequence("s", X+Bases.GAP+Z+X.substring(40)+Y));
		Assert.assertEquals(joined.seq_str(), X+Y);
	}

	@Test
	public void testNoGap() {
		Sequence plain = new Sequence("s", X);
		Assert.assertSame(joiner.join(plain), plain);
	}

	@Test(expectedExceptions = UnresolvableGapException.class)
	public void testUnrelatedSides() {
		joiner.join(new Sequence("s", X+Bases.GAP+Y));
	}
}
