package gapcloser.ngs.tools;

import java.io.File;
import java.io.IOException;
import java.util.List;

import gapcloser.ngs.assembly.CorrectionStage;
import gapcloser.ngs.model.Sequence;
import gapcloser.util.ConfigurationException;

/**
 * Joins an extended reference across its gap and corrects it against the reads.
 */
public class Finisher extends PipelineTool {

	private List<File> outputs = null;

	@Override
	public void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+ common_usage
						+ "\n");
	}

	@Override
	public void run() {
		final Sequence reference = readExtended(reference_file);
		this.prepare();
		try {
			final String sample = this.sample(reference);
			List<Sequence> corrected = new CorrectionStage(collaborators, mode).correct(reference, sample);
			this.outputs = this.writeOutput(corrected, ".closed");
		} finally {
			this.cleanup();
		}
	}

	public List<File> outputs() {
		return this.outputs;
	}

	static Sequence readExtended(String fa) {
		try {
			List<Sequence> sequences = Sequence.parseFastaFileAsList(fa);
			if(sequences.size()!=1)
				throw new ConfigurationException("Reference "+fa+" must hold exactly one sequence.");
			return sequences.get(0);
		} catch (IOException e) {
			throw new ConfigurationException("Could not read reference "+fa, e);
		}
	}
}
