package gapcloser.ngs.external;

import java.io.File;
import java.io.IOException;

import gapcloser.ngs.model.Sequence;
import gapcloser.util.CollaboratorFailureException;
import gapcloser.util.CommandRunner;
import gapcloser.util.Utils;

/**
 * Directory holding the intermediate files of the external programs, together with
 * the runner used to invoke them. Files are named after the label of the step that
 * wrote them.
 */
public class WorkDirectory {

	private final File dir;
	private final CommandRunner runner;

	public WorkDirectory(File dir, CommandRunner runner) {
		this.dir = dir;
		this.runner = runner;
		Utils.makeOutputDir(dir);
	}

	public String path(String name) {
		return new File(this.dir, name).getPath();
	}

	/**
	 * Single-quotes a path for use in a <tt>bash -c</tt> command line.
	 */
	public static String quote(String path) {
		return "'"+path.replace("'", "'\\''")+"'";
	}

	public void run(String command) {
		this.runner.run(command);
	}

	/**
	 * Writes the reference to <tt>label.fa</tt> and returns its path.
	 */
	public String writeReference(Sequence reference, String label) {
		File fa = new File(this.dir, label+".fa");
		try {
			Sequence.writeFastaFile(fa, reference);
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not write "+fa, e);
		}
		return fa.getPath();
	}

	public void delete() {
		Utils.deleteDirectory(this.dir);
	}
}
