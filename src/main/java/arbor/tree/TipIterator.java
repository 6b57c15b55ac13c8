package arbor.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Tips below the start node in left to right order. A tip start yields itself only when
 * includeSelf is set.
 */
class TipIterator extends NodeIterator {

	private final ArrayList<TreeNode> stack;

	TipIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.stack = new ArrayList<TreeNode>();
		if (start.isInternal() || includeSelf) {
			this.stack.add(start);
		}
	}

	@Override
	protected TreeNode advance() {
		while (!this.stack.isEmpty()) {
			TreeNode curr = this.stack.remove(this.stack.size() - 1);
			List<TreeNode> kids = curr.children;
			if (kids.isEmpty()) {
				return curr;
			}
			for (int i = kids.size() - 1; i >= 0; i--) {
				this.stack.add(kids.get(i));
			}
		}
		return null;
	}
}
