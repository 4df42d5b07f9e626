package gapcloser.util;

/**
 * Base type of the errors that end a gap closing run.
 */
public class GapCloserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public GapCloserException(String message) {
		super(message);
	}

	public GapCloserException(String message, Throwable cause) {
		super(message, cause);
	}
}
