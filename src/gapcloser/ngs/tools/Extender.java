package gapcloser.ngs.tools;

import java.io.File;
import java.util.Collections;

import gapcloser.ngs.assembly.ExtensionLoop;
import gapcloser.ngs.assembly.FastaSnapshotStore;
import gapcloser.ngs.assembly.LoopResult;
import gapcloser.ngs.model.Sequence;

/**
 * Runs the extension loop and writes the extended, still gapped, reference.
 */
public class Extender extends PipelineTool {

	private LoopResult result = null;

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
			this.writeOutput(Collections.singletonList(result.sequence().rename(sample)), ".extended");
			myLogger.info("Terminal state "+result.state()+" after "+result.iterations().size()+" iterations");
		} finally {
			this.cleanup();
		}
	}

	public LoopResult result() {
		return this.result;
	}
}
