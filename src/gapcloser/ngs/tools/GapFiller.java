package gapcloser.ngs.tools;

import java.io.File;
import java.util.List;

import gapcloser.ngs.assembly.CorrectionStage;
import gapcloser.ngs.assembly.ExtensionLoop;
import gapcloser.ngs.assembly.FastaSnapshotStore;
import gapcloser.ngs.assembly.LoopResult;
import gapcloser.ngs.model.Sequence;

/**
 * The whole pipeline: extend both sides of the gap, join them and correct the
 * result.
 */
public class GapFiller extends PipelineTool {

	private LoopResult result = null;
	private List<File> outputs = null;

	@Override
	public void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+ common_usage
						+ extension_usage
						+ "\n");
	}

	@Override
	public void run() {
		final Sequence reference = Sequence.parseReference(reference_file);
		this.prepare();
		try {
			final String sample = this.sample(reference);
			final ExtensionLoop loop = new ExtensionLoop(collaborators, mode, max_iter, coverage,
					new FastaSnapshotStore(new File(out_dir, "snapshots"), sample));
			this.result = loop.run(reference.rename(sample), resume);
			myLogger.info("Terminal state "+result.state()+" after "+result.iterations().size()+
					" iterations, "+reference.seq_ln()+"bp -> "+result.sequence().seq_ln()+"bp");

			List<Sequence> corrected = new CorrectionStage(collaborators, mode).correct(result.sequence(), sample);
			this.outputs = this.writeOutput(corrected, ".closed");
			usage();
		} finally {
			this.cleanup();
		}
	}

	public LoopResult result() {
		return this.result;
	}

	public List<File> outputs() {
		return this.outputs;
	}
}
