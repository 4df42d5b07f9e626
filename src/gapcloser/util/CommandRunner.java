package gapcloser.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs shell commands synchronously through {@code bash -c}. A command either exits
 * with status zero or the run fails with a {@link CollaboratorFailureException};
 * nothing is retried.
 */
public class CommandRunner {

	private final static Logger myLogger = LogManager.getLogger(CommandRunner.class);
	private final static int TAIL_LINES = 20;

	public boolean available(String tool) {
		String command = "command -v "+tool+
				" >/dev/null 2>&1 && { echo \"true\"; } || { echo \"false\"; }";
		try {
			Process check = bash(command);
			String line;
			try (BufferedReader in = new BufferedReader(
					new InputStreamReader(check.getInputStream(), StandardCharsets.UTF_8))) {
				line = in.readLine();
			}
			check.waitFor();
			return "true".equals(line);
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not probe for "+tool, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CollaboratorFailureException("Interrupted while probing for "+tool, e);
		}
	}

	/**
	 * Runs the command to completion. Standard output and error are merged and logged
	 * at debug level; the last lines are kept for the failure message.
	 */
	public void run(String command) {
		myLogger.info("Running: "+command);
		final Deque<String> tail = new ArrayDeque<String>(TAIL_LINES);
		final int status;
		try {
			Process process = bash(command);
			try (BufferedReader in = new BufferedReader(
					new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
				String line;
				while( (line=in.readLine())!=null ) {
					myLogger.debug(line);
					if(tail.size()==TAIL_LINES) tail.removeFirst();
					tail.addLast(line);
				}
			}
			status = process.waitFor();
		} catch (IOException e) {
			throw new CollaboratorFailureException("Could not run: "+command, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CollaboratorFailureException("Interrupted: "+command, e);
		}
		if(status!=0) {
			throw new CollaboratorFailureException("Command exited with status "+status+": "+command
					+"\n"+String.join("\n", tail));
		}
	}

	protected Process bash(String command) throws IOException {
		ProcessBuilder builder = new ProcessBuilder("bash", "-c", command);
		builder.redirectErrorStream(true);
		return builder.start();
	}
}
