package arbor.exceptions;

/**
 * Base class for the errors raised by name lookup and distance accumulation on a tree.
 */
public class TreeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public TreeException(String message) {
		super(message);
	}
}
