package arbor.exceptions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Thrown when a lookup by name finds no node. Keeps every missing name so that callers
 * resolving a batch can report them together.
 */
public class MissingNodeException extends TreeException {

	private static final long serialVersionUID = 1L;

	private final ArrayList<String> missingNames;

	// single name constructor
	public MissingNodeException(String name) {
		super("node '" + name + "' is not in the tree");
		this.missingNames = new ArrayList<String>();
		this.missingNames.add(name);
	}

	// list of names constructor
	public MissingNodeException(List<String> names) {
		super("nodes '" + StringUtils.join(names, ", ") + "' are not in the tree");
		this.missingNames = new ArrayList<String>(names);
	}

	public List<String> getMissingNames() {
		return this.missingNames;
	}

	public String getQuotedName() {
		return "'" + StringUtils.join(this.missingNames, ", ") + "'";
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String noun = (this.missingNames.size() == 1 ? "node" : "nodes");
		out.println(failedAction + " failed; " + noun + " not found: " + this.getQuotedName());
	}
}
