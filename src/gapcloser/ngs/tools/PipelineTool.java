package gapcloser.ngs.tools;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import gapcloser.ngs.assembly.PloidyMode;
import gapcloser.ngs.external.Collaborators;
import gapcloser.ngs.external.WorkDirectory;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.ArgsEngine;
import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.ConfigurationException;
import gapcloser.util.Constants;
import gapcloser.util.Executor;
import gapcloser.util.Utils;

/**
 * Options and plumbing shared by the gap closing tools.
 */
public abstract class PipelineTool extends Executor {

	private final static Pattern sample_id = Pattern.compile("[A-Za-z0-9.]+");

	protected String reference_file = null;
	protected String read1_file = null;
	protected String read2_file = null;
	protected String sample = null;
	protected String out_dir = "./";
	protected int max_iter = Constants.DEFAULT_MAX_ITERATIONS;
	protected int coverage = Constants.DEFAULT_PREDICTED_COVERAGE;
	protected PloidyMode mode = PloidyMode.HOMOZYGOUS;
	protected boolean keep_temp = false;
	protected boolean resume = false;

	protected Collaborators collaborators = null;
	protected WorkDirectory work = null;

	protected final static String common_usage =
			  " -r/--reference          Reference FASTA: one header line and one sequence line.\n"
			+ " -1/--read1              Forward paired-end reads (FASTQ, optionally gzipped).\n"
			+ " -2/--read2              Reverse paired-end reads (FASTQ, optionally gzipped).\n"
			+ " -s/--sample             Sample id used to name outputs (default: reference id).\n"
			+ " -het/--heterozygous     Treat the sample as heterozygous: phase reads into\n"
			+ "                         two haplotypes.\n"
			+ " -t/--threads            Threads for the aligner (default 1).\n"
			+ " -k/--keep-temp          Keep intermediate files in <out-dir>/work.\n"
			+ " -o/--out-dir            Output directory (default current directory).\n";

	protected final static String extension_usage =
			  " -l/--max-iterations     Maximum number of extension rounds (default "+Constants.DEFAULT_MAX_ITERATIONS+").\n"
			+ " -c/--coverage           Predicted coverage; a side is not extended when its\n"
			+ "                         boundary depth exceeds 3 times this (default "+Constants.DEFAULT_PREDICTED_COVERAGE+").\n"
			+ " -R/--resume             Resume from the latest iteration snapshot in <out-dir>/snapshots.\n";

	@Override
	public void setParameters(String[] args) {
		if (args.length == 0) {
			printUsage();
			throw new ConfigurationException("\n\nPlease use the above arguments/options.\n\n");
		}

		if (myArgsEngine == null) {
			myArgsEngine = new ArgsEngine();
			myArgsEngine.add("-r", "--reference", true);
			myArgsEngine.add("-1", "--read1", true);
			myArgsEngine.add("-2", "--read2", true);
			myArgsEngine.add("-s", "--sample", true);
			myArgsEngine.add("-het", "--heterozygous");
			myArgsEngine.add("-t", "--threads", true);
			myArgsEngine.add("-k", "--keep-temp");
			myArgsEngine.add("-o", "--out-dir", true);
			myArgsEngine.add("-l", "--max-iterations", true);
			myArgsEngine.add("-c", "--coverage", true);
			myArgsEngine.add("-R", "--resume");
			myArgsEngine.parse(args);
		}

		if (myArgsEngine.getBoolean("-r")) {
			reference_file = myArgsEngine.getString("-r");
		} else {
			printUsage();
			throw new ConfigurationException("Please specify the reference.");
		}

		if (myArgsEngine.getBoolean("-1") && myArgsEngine.getBoolean("-2")) {
			read1_file = myArgsEngine.getString("-1");
			read2_file = myArgsEngine.getString("-2");
		} else {
			printUsage();
			throw new ConfigurationException("Please specify both read files.");
		}

		for(String f : new String[]{reference_file, read1_file, read2_file}) {
			if(!Utils.isReadableFile(f))
				throw new ConfigurationException("Input file "+f+" does not exist or cannot be read.");
		}

		if (myArgsEngine.getBoolean("-s")) {
			sample = myArgsEngine.getString("-s");
			if(!sample_id.matcher(sample).matches())
				throw new ConfigurationException("Invalid sample id \""+sample+
						"\": only letters, digits and periods are allowed.");
		}

		if (myArgsEngine.getBoolean("-het")) {
			mode = PloidyMode.HETEROZYGOUS;
		}

		THREADS = myArgsEngine.getInt("-t", 1);
		max_iter = myArgsEngine.getInt("-l", Constants.DEFAULT_MAX_ITERATIONS);
		coverage = myArgsEngine.getInt("-c", Constants.DEFAULT_PREDICTED_COVERAGE);
		if(THREADS<1 || max_iter<1 || coverage<1)
			throw new ConfigurationException("Threads, iterations and coverage must be positive.");

		keep_temp = myArgsEngine.getBoolean("-k");
		resume = myArgsEngine.getBoolean("-R");

		if (myArgsEngine.getBoolean("-o")) {
			out_dir = myArgsEngine.getString("-o");
		}
	}

	/**
	 * Replaces the command line collaborators, which skips the check for the
	 * external programs.
	 */
	public void setCollaborators(Collaborators collaborators) {
		this.collaborators = collaborators;
	}

	/**
	 * Checks the external programs and opens the working directory. Nothing is run
	 * before this succeeds.
	 */
	protected void prepare() {
		Utils.makeOutputDir(out_dir);
		if(this.collaborators==null) {
			this.require(Collaborators.REQUIRED_TOOLS.toArray(new String[0]));
			this.work = new WorkDirectory(new File(out_dir, "work"), myRunner);
			this.collaborators = Collaborators.commandLine(work, read1_file, read2_file, THREADS);
		}
	}

	protected void cleanup() {
		if(this.work!=null && !keep_temp) this.work.delete();
	}

	protected String sample(Sequence reference) {
		return this.sample==null ? reference.seq_sn() : this.sample;
	}

	/**
	 * Writes each sequence to <tt>&lt;out-dir&gt;/&lt;name&gt;&lt;suffix&gt;.fa</tt>. Nothing
	 * is written when any of the files would replace the input reference.
	 */
	protected List<File> writeOutput(List<Sequence> sequences, String suffix) {
		final List<File> files = new ArrayList<File>();
		for(Sequence sequence : sequences) {
			File out = new File(out_dir, sequence.seq_sn()+suffix+".fa");
			if(sameFile(out, new File(reference_file)))
				throw new ConfigurationException("Output "+out+" would overwrite the reference "+
						reference_file+"; use another output directory or sample id.");
			files.add(out);
		}
		for(int i=0; i<files.size(); i++) {
			final Sequence sequence = sequences.get(i);
			final File out = files.get(i);
			try {
				Sequence.writeFastaFile(out, sequence);
			} catch (IOException e) {
				throw new CollaboratorFailureException("Could not write "+out, e);
			}
			myLogger.info("Wrote "+sequence.seq_sn()+" ("+sequence.seq_ln()+"bp) to "+out);
		}
		return files;
	}

	private static boolean sameFile(File f1, File f2) {
		try {
			return f1.getCanonicalFile().equals(f2.getCanonicalFile());
		} catch (IOException e) {
			throw new ConfigurationException("Could not resolve "+f1+" against "+f2, e);
		}
	}
}
