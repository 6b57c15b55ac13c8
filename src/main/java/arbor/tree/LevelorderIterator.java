package arbor.tree;

import java.util.ArrayDeque;

/**
 * Breadth first walk using a FIFO queue.
 */
class LevelorderIterator extends NodeIterator {

	private final ArrayDeque<TreeNode> queue;

	LevelorderIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.queue = new ArrayDeque<TreeNode>();
		this.queue.add(start);
	}

	@Override
	protected TreeNode advance() {
		while (!this.queue.isEmpty()) {
			TreeNode curr = this.queue.poll();
			this.queue.addAll(curr.children);
			if (this.includeSelf || curr != this.start) {
				return curr;
			}
		}
		return null;
	}
}
