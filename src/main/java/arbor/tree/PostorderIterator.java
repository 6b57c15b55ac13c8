package arbor.tree;

import gnu.trove.list.array.TIntArrayList;

/**
 * Depth first, each node after its children.
 *
 * Rather than keeping (node, index) pairs on the stack this keeps only the child index of
 * each level and climbs back up through the parent links; the current node is the only
 * node reference held. Tips are returned as soon as they are reached, internal children
 * are descended into.
 */
class PostorderIterator extends NodeIterator {

	private final TIntArrayList childIndexStack;
	private TreeNode curr;
	private boolean done;

	PostorderIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.childIndexStack = new TIntArrayList();
		this.childIndexStack.add(0);
		this.curr = start;
		this.done = false;
	}

	@Override
	protected TreeNode advance() {
		while (!this.done) {
			int top = this.childIndexStack.size() - 1;
			int currIndex = this.childIndexStack.get(top);
			if (currIndex < this.curr.children.size()) {
				TreeNode child = this.curr.children.get(currIndex);
				if (child.isInternal()) {
					this.childIndexStack.add(0);
					this.curr = child;
				} else {
					this.childIndexStack.set(top, currIndex + 1);
					return child;
				}
			} else {
				// no children left, emit curr and move to its parent
				TreeNode visited = this.curr;
				if (visited == this.start) {
					this.done = true;
				} else {
					this.curr = visited.parent;
					this.childIndexStack.removeAt(top);
					this.childIndexStack.set(top - 1, this.childIndexStack.get(top - 1) + 1);
				}
				if (this.includeSelf || visited != this.start) {
					return visited;
				}
			}
		}
		return null;
	}
}
