package gapcloser.ngs.external;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import gapcloser.ngs.model.AlignmentSet;
import gapcloser.ngs.model.ReadAlignment;
import gapcloser.ngs.model.Sequence;
import gapcloser.ngs.model.VariantCall;
import gapcloser.ngs.model.VariantCalls;

public class CommandLineCollaboratorsUnitTest {

	private File dir;
	private RecordingRunner runner;
	private WorkDirectory work;

	@BeforeMethod
	public void setUp() throws IOException {
		dir = Files.createTempDirectory("work").toFile();
		runner = new RecordingRunner();
		work = new WorkDirectory(dir, runner);
	}

	@AfterMethod
	public void tearDown() throws IOException {
		FileUtils.deleteDirectory(dir);
	}

	@Test
	public void testAlignCommand() {
		BwaAligner bwa = new BwaAligner(work, "r1.fq.gz", "r2.fq.gz", 4);
		Assert.assertEquals(bwa.alignCommand("ref.fa", "out.bam"),
				"set -o pipefail; bwa mem -t 4 'ref.fa' 'r1.fq.gz' 'r2.fq.gz' | samtools sort -@ 4 -o 'out.bam' -");
	}

	@Test
	public void testAlignCommandWithSpacedPaths() {
		BwaAligner bwa = new BwaAligner(work, "my reads/r1.fq.gz", "my reads/r2.fq.gz", 1);
		Assert.assertEquals(bwa.alignCommand("run 1/ref.fa", "run 1/out.bam"),
				"set -o pipefail; bwa mem -t 1 'run 1/ref.fa' 'my reads/r1.fq.gz' 'my reads/r2.fq.gz'"
				+ " | samtools sort -@ 1 -o 'run 1/out.bam' -");
	}

	@Test
	public void testQuote() {
		Assert.assertEquals(WorkDirectory.quote("/tmp/a b/ref.fa"), "'/tmp/a b/ref.fa'");
		Assert.assertEquals(WorkDirectory.quote("O'Brien.fa"), "'O'\\''Brien.fa'");
		Assert.assertEquals(WorkDirectory.quote("$HOME;rm"), "'$HOME;rm'");
	}

	@Test
	public void testDownsampleCommand() {
		Assert.assertEquals(SamtoolsProcessor.downsampleCommand("in.bam", "out.bam", 0.25),
				"samtools view -b -s 0.2500 -o 'out.bam' 'in.bam'");
	}

	@Test
	public void testNoDownsampleAtFullFraction() {
		AlignmentSet alignments = new AlignmentSet(Collections.singletonList(new ReadAlignment("r", "ACGT", 1)));
		Assert.assertSame(new SamtoolsProcessor(work).downsample(alignments, 1.0, "iter1"), alignments);
		Assert.assertTrue(runner.commands.isEmpty());
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void testInMemoryAlignmentsHaveNoBam() {
		new SamtoolsProcessor(work).markDuplicates(new Sequence("ref", "ACGT"),
				new AlignmentSet(Collections.<ReadAlignment>emptyList()), "iter1");
	}

	@Test
	public void testNoVariantsLeaveReference() {
		Sequence reference = new Sequence("ref", "ACGT");
		Assert.assertSame(new FreebayesCaller(work).apply(reference,
				new VariantCalls(Collections.<VariantCall>emptyList()), "final"), reference);
		Assert.assertTrue(runner.commands.isEmpty());
	}

	@Test
	public void testReadVariants() throws IOException {
		File vcf = new File(dir, "calls.vcf");
		Files.write(vcf.toPath(), (
				"##fileformat=VCFv4.2\n"
				+ "##contig=<ID=ref,length=100>\n"
				+ "#CHROM\tPOS\tID\tREF\tALT\tQUAL\tFILTER\tINFO\n"
				+ "ref\t10\t.\tA\tG\t50\t.\t.\n"
				+ "ref\t20\t.\tC\t.\t50\t.\t.\n"
				+ "ref\t30\t.\tTA\tT\t50\t.\t.\n").getBytes(StandardCharsets.UTF_8));
		VariantCalls calls = FreebayesCaller.read(vcf);
		Assert.assertEquals(calls.size(), 2);
		Assert.assertEquals(calls.calls().get(0).position(), 10);
		Assert.assertEquals(calls.calls().get(0).alt(), "G");
		Assert.assertEquals(calls.calls().get(1).ref(), "TA");
		Assert.assertEquals(calls.vcf(), vcf);
	}

	@Test
	public void testWriteReference() throws IOException {
		String fa = work.writeReference(new Sequence("ref", "ACGTnnAC"), "iter2");
		Assert.assertEquals(new File(fa), new File(dir, "iter2.fa"));
		Assert.assertEquals(Sequence.parseFastaFileAsList(fa).get(0).seq_str(), "ACGTnnAC");
	}

	@Test
	public void testRequiredTools() {
		Assert.assertTrue(Collaborators.REQUIRED_TOOLS.contains("bwa"));
		Assert.assertTrue(Collaborators.REQUIRED_TOOLS.contains("muscle"));
		Collaborators collaborators = Collaborators.commandLine(work, "r1.fq", "r2.fq", 2);
		Assert.assertTrue(collaborators.aligner() instanceof BwaAligner);
		Assert.assertTrue(collaborators.phaser() instanceof SamtoolsPhaser);
	}
}
