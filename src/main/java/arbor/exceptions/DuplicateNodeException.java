package arbor.exceptions;

/**
 * Thrown when the name cache finds two nodes carrying the same name in one subtree.
 */
public class DuplicateNodeException extends TreeException {

	private static final long serialVersionUID = 1L;

	private final String name;

	public DuplicateNodeException(String name) {
		super("node name '" + name + "' already exists!");
		this.name = name;
	}

	public String getName() {
		return this.name;
	}
}
