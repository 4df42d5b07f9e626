package gapcloser.util;

/**
 * A required input is missing or malformed.
 */
public class ConfigurationException extends GapCloserException {

	private static final long serialVersionUID = 1L;

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
