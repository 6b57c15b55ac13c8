package arbor.exceptions;

/**
 * Thrown when a distance is summed across a branch whose length is unknown.
 */
public class NoLengthException extends TreeException {

	private static final long serialVersionUID = 1L;

	public NoLengthException(String nodeName) {
		super("node " + (nodeName == null ? "<unnamed>" : "'" + nodeName + "'") + " has no branch length");
	}
}
