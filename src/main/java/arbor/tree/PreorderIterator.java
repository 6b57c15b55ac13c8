package arbor.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth first, each node before its children. Children are pushed in reverse so that they
 * come off the stack in their original order.
 */
class PreorderIterator extends NodeIterator {

	private final ArrayList<TreeNode> stack;

	PreorderIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.stack = new ArrayList<TreeNode>();
		this.stack.add(start);
	}

	@Override
	protected TreeNode advance() {
		while (!this.stack.isEmpty()) {
			TreeNode curr = this.stack.remove(this.stack.size() - 1);
			List<TreeNode> kids = curr.children;
			for (int i = kids.size() - 1; i >= 0; i--) {
				this.stack.add(kids.get(i));
			}
			if (this.includeSelf || curr != this.start) {
				return curr;
			}
		}
		return null;
	}
}
