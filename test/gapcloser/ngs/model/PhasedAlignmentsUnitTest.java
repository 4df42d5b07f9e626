package gapcloser.ngs.model;

import java.util.Arrays;

import org.testng.Assert;
import org.testng.annotations.Test;

public class PhasedAlignmentsUnitTest {

	private static AlignmentSet reads(int n) {
		ReadAlignment[] records = new ReadAlignment[n];
		for(int i=0; i<n; i++) records[i] = new ReadAlignment("r"+i, "ACGT", i+1);
		return new AlignmentSet(Arrays.asList(records));
	}

	@Test
	public void testDominantBin() {
		Assert.assertEquals(PhasedAlignments.separated(reads(3), reads(5)).dominant(), HaplotypeBin.ONE);
		Assert.assertEquals(PhasedAlignments.separated(reads(5), reads(3)).dominant(), HaplotypeBin.ZERO);
		Assert.assertEquals(PhasedAlignments.separated(reads(4), reads(4)).dominant(), HaplotypeBin.ZERO);
	}

	@Test
	public void testEmptySecondBinIsNotSeparated() {
		PhasedAlignments phased = PhasedAlignments.separated(reads(4), reads(0));
		Assert.assertFalse(phased.isSeparated());
		Assert.assertEquals(phased.dominant(), HaplotypeBin.ZERO);
	}

	@Test
	public void testUnseparated() {
		PhasedAlignments phased = PhasedAlignments.unseparated(reads(2));
		Assert.assertFalse(phased.isSeparated());
		Assert.assertEquals(phased.dominant(), HaplotypeBin.UNSEPARATED);
		Assert.assertEquals(phased.get(HaplotypeBin.UNSEPARATED).size(), 2);
		Assert.assertEquals(HaplotypeBin.UNSEPARATED.label(), "2");
	}
}
