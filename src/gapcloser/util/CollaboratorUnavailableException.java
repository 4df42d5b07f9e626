package gapcloser.util;

/**
 * An external program the pipeline depends on cannot be found on the system path.
 */
public class CollaboratorUnavailableException extends GapCloserException {

	private static final long serialVersionUID = 1L;

	private final String tool;

	public CollaboratorUnavailableException(String tool) {
		super("\n\nTool "+tool+" is required but not available on this machine.\n"
				+ "If you have already installed it, you will need to add it\n"
				+ "to system path or use \"module load\" to load the tool.\n\n ");
		this.tool = tool;
	}

	public String tool() {
		return this.tool;
	}
}
