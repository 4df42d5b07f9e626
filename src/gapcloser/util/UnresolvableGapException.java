package gapcloser.util;

/**
 * The two sides of a gap cannot be joined: neither flanking anchor is found on the
 * opposite side.
 */
public class UnresolvableGapException extends GapCloserException {

	private static final long serialVersionUID = 1L;

	public UnresolvableGapException(String message) {
		super(message);
	}
}
