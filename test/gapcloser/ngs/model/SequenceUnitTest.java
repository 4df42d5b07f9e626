package gapcloser.ngs.model;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.NoSuchElementException;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import gapcloser.util.ConfigurationException;

public class SequenceUnitTest {

	@Test
	public void testGapRunIsExactlyTenBases() {
		Assert.assertEquals(new Sequence("s", "ACGTNNNNNNNNNNACGT").gapRun(), new GapRun(4));
		Assert.assertEquals(new Sequence("s", "ACGTnnnnnNNNNNACGT").gapRun(), new GapRun(4));
		Assert.assertNull(new Sequence("s", "ACGTNNNNNNNNNNNACGT").gapRun());
		Assert.assertNull(new Sequence("s", "ACGTNNNNNNNNNACGT").gapRun());
		Assert.assertEquals(new Sequence("s", "NNACNNNNNNNNNN").gapRun(), new GapRun(4));
	}

	@Test
	public void testGapRunCoordinates() {
		GapRun gap = new GapRun(60);
		Assert.assertEquals(gap.end(), 70);
		Assert.assertEquals(gap.position(), 61);
		Assert.assertEquals(gap.leftBoundary(), 56);
		Assert.assertEquals(gap.rightBoundary(), 76);
	}

	@Test
	public void testCountGapRuns() {
		Assert.assertEquals(new Sequence("s", "ACGT").countGapRuns(), 0);
		Assert.assertEquals(new Sequence("s", "A"+Bases.GAP+"C"+Bases.GAP+"G").countGapRuns(), 2);
		Assert.assertEquals(new Sequence("s", "A"+Bases.GAP+"NC"+Bases.GAP).countGapRuns(), 1);
	}

	@Test
	public void testCountOccurrencesIgnoresCase() {
		Sequence s = new Sequence("s", "acgtACGTacGT");
		Assert.assertEquals(s.countOccurrences("ACGT"), 3);
		Assert.assertEquals(new Sequence("s", "AAAA").countOccurrences("AA"), 2);
		Assert.assertEquals(s.countOccurrences("TTTT"), 0);
		Assert.assertEquals(s.countOccurrences(""), 0);
	}

	@Test
	public void testReplaceFirstOccurrence() {
		Sequence s = new Sequence("s", "AACCGGCC");
		Assert.assertEquals(s.replace("cc", "tt").seq_str(), "AAttGGCC");
		Assert.assertEquals(s.replace("cc", "tt").seq_sn(), "s");
	}

	@Test(expectedExceptions = NoSuchElementException.class)
	public void testReplaceMissing() {
		new Sequence("s", "AACC").replace("GG", "TT");
	}

	@Test
	public void testSlice() {
		Sequence s = new Sequence("s", "ACGTACGT");
		Assert.assertEquals(s.slice(2, 5), "GTA");
		Assert.assertNull(s.slice(-1, 3));
		Assert.assertNull(s.slice(6, 9));
	}

	@Test
	public void testWriteAndParseFasta() throws IOException {
		File fa = File.createTempFile("sequence", ".fa");
		fa.deleteOnExit();
		Sequence.writeFastaFile(fa, new Sequence("a", "ACGT"), new Sequence("b", "ggcc"));
		List<Sequence> sequences = Sequence.parseFastaFileAsList(fa.getPath());
		Assert.assertEquals(sequences.size(), 2);
		Assert.assertEquals(sequences.get(0), new Sequence("a", "ACGT"));
		Assert.assertEquals(sequences.get(1), new Sequence("b", "ggcc"));
	}

	@Test
	public void testParseReference() throws IOException {
		Sequence reference = Sequence.parseReference(write(">chr1.2\nACGT"+Bases.GAP+"TTGA\n"));
		Assert.assertEquals(reference.seq_sn(), "chr1.2");
		Assert.assertEquals(reference.gapRun(), new GapRun(4));
	}

	@DataProvider(name = "badReferences")
	public Object[][] badReferences() {
		return new Object[][] {
			{">chr1\nACGTACGT\n"},
			{">chr1\nAC"+Bases.GAP+"GT"+Bases.GAP+"A\n"},
			{">chr_1\nACGT"+Bases.GAP+"ACGT\n"},
			{">chr1\nACGT"+Bases.GAP+"ACGR\n"},
			{">chr1\nACGT"+Bases.GAP+"\nACGT\n"},
			{"ACGT"+Bases.GAP+"ACGT\n"},
		};
	}

	@Test(dataProvider = "badReferences", expectedExceptions = ConfigurationException.class)
	public void testParseReferenceRejects(String content) throws IOException {
		Sequence.parseReference(write(content));
	}

	private static String write(String content) throws IOException {
		File fa = File.createTempFile("reference", ".fa");
		fa.deleteOnExit();
		Files.write(fa.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return fa.getPath();
	}
}
