package gapcloser.util;

/**
 * An external program exited abnormally or left unusable output behind.
 */
public class CollaboratorFailureException extends GapCloserException {

	private static final long serialVersionUID = 1L;

	public CollaboratorFailureException(String message) {
		super(message);
	}

	public CollaboratorFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
