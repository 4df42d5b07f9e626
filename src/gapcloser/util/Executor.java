package gapcloser.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A command line tool: parses its own options, checks the programs it needs and runs.
 */
public abstract class Executor {

	protected final static int mb = 1024*1024;
	protected final static Runtime instance = Runtime.getRuntime();

	protected final static Logger myLogger = LogManager.getLogger(Executor.class);

	protected ArgsEngine myArgsEngine = null;
	protected CommandRunner myRunner = new CommandRunner();

	public abstract void printUsage();

	public abstract void setParameters(String[] args);

	public abstract void run();

	protected int THREADS = 1;

	protected void require(String tool) {
		if(!myRunner.available(tool))
			throw new CollaboratorUnavailableException(tool);
	}

	protected void require(String... tools) {
		for(String tool : tools) require(tool);
	}

	protected static double maxMemory() {
		return instance.maxMemory() / mb;
	}

	protected static double totalMemory() {
		return instance.totalMemory() / mb;
	}

	protected static double freeMemory() {
		return instance.freeMemory() / mb;
	}

	protected static double usedMemory() {
		return totalMemory()-freeMemory();
	}

	protected static void usage() {
		myLogger.info("Max Memory: "+maxMemory());
		myLogger.info("Total Memory: "+totalMemory());
		myLogger.info("Free Memory: "+freeMemory());
		myLogger.info("Used Memory: "+usedMemory());
	}
}
