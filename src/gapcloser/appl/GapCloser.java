package gapcloser.appl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import gapcloser.ngs.tools.Extender;
import gapcloser.ngs.tools.Finisher;
import gapcloser.ngs.tools.GapFiller;
import gapcloser.util.ConfigurationException;

public class GapCloser {

	protected final static Logger myLogger = LogManager.getLogger(GapCloser.class);

	public static void main(String[] args) {

		if(args.length<1) {
			printUsage();
			throw new ConfigurationException("Undefined tool!!!");
		}
		String[] args2 = new String[args.length-1];
		System.arraycopy(args, 1, args2, 0, args2.length);
		switch(args[0].toLowerCase()) {
		case "extend":
			Extender extender = new Extender();
			extender.setParameters(args2);
			extender.run();
			break;
		case "finish":
			Finisher finisher = new Finisher();
			finisher.setParameters(args2);
			finisher.run();
			break;
		case "close":
			GapFiller filler = new GapFiller();
			filler.setParameters(args2);
			filler.run();
			break;
		default:
			printUsage();
			throw new ConfigurationException("Undefined tool!!!");
		}
	}

	private static void printUsage() {
		myLogger.info(
				"\n\nUsage is as follows:\n"
						+ " extend      Extend the scaffolds flanking a gap towards each other.\n"
						+ " finish      Join an extended reference across its gap and correct it.\n"
						+ " close       Run extend and finish in one go.\n\n");
	}
}
