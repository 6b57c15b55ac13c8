package arbor.exceptions;

/**
 * Thrown when a walk towards an ancestor reaches the root without passing that ancestor.
 */
public class NoParentException extends TreeException {

	private static final long serialVersionUID = 1L;

	public NoParentException(String message) {
		super(message);
	}
}
