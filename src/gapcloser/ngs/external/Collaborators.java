package gapcloser.ngs.external;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The external programs a gap closing run talks to.
 */
public class Collaborators {

	/** Executables the command line collaborators need on the system path. */
	public final static List<String> REQUIRED_TOOLS = Collections.unmodifiableList(
			Arrays.asList("bwa", "samtools", "lofreq", "muscle", "freebayes", "bgzip", "tabix", "bcftools"));

	private final Aligner aligner;
	private final AlignmentProcessor processor;
	private final CoverageReporter coverage;
	private final Phaser phaser;
	private final MultipleSequenceAligner msa;
	private final VariantCaller caller;

	public Collaborators(Aligner aligner,
			AlignmentProcessor processor,
			CoverageReporter coverage,
			Phaser phaser,
			MultipleSequenceAligner msa,
			VariantCaller caller) {
		this.aligner = aligner;
		this.processor = processor;
		this.coverage = coverage;
		this.phaser = phaser;
		this.msa = msa;
		this.caller = caller;
	}

	/**
	 * Collaborators backed by bwa, samtools, lofreq, muscle, freebayes and bcftools,
	 * writing their intermediate files to <tt>work</tt>.
	 */
	public static Collaborators commandLine(WorkDirectory work,
			String read1,
			String read2,
			int threads) {
		return new Collaborators(
				new BwaAligner(work, read1, read2, threads),
				new SamtoolsProcessor(work),
				new SamtoolsDepth(work),
				new SamtoolsPhaser(work),
				new MuscleAligner(work),
				new FreebayesCaller(work));
	}

	public Aligner aligner() {
		return this.aligner;
	}

	public AlignmentProcessor processor() {
		return this.processor;
	}

	public CoverageReporter coverage() {
		return this.coverage;
	}

	public Phaser phaser() {
		return this.phaser;
	}

	public MultipleSequenceAligner msa() {
		return this.msa;
	}

	public VariantCaller caller() {
		return this.caller;
	}
}
