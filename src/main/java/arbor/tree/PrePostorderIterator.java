package arbor.tree;

import java.util.ArrayDeque;

import gnu.trove.list.array.TIntArrayList;

/**
 * Visits every internal node twice, before its first child and after its last one, and
 * every tip once. Same index stack and parent climbing as {@link PostorderIterator}; a node
 * is emitted when its index is first seen at zero and again when the index is exhausted.
 */
class PrePostorderIterator extends NodeIterator {

	private final TIntArrayList childIndexStack;
	private final ArrayDeque<TreeNode> pending;
	private TreeNode curr;
	private boolean done;

	PrePostorderIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.childIndexStack = new TIntArrayList();
		this.childIndexStack.add(0);
		this.pending = new ArrayDeque<TreeNode>();
		this.curr = start;
		if (start.isTip()) {
			// a lone tip is reported once
			this.done = true;
			if (includeSelf) {
				this.pending.add(start);
			}
		} else {
			this.done = false;
		}
	}

	@Override
	protected TreeNode advance() {
		while (this.pending.isEmpty() && !this.done) {
			this.step();
		}
		return this.pending.poll();
	}

	private void step() {
		int top = this.childIndexStack.size() - 1;
		int currIndex = this.childIndexStack.get(top);
		if (currIndex == 0) {
			this.emit(this.curr);
		}
		if (currIndex < this.curr.children.size()) {
			TreeNode child = this.curr.children.get(currIndex);
			if (child.isInternal()) {
				this.childIndexStack.add(0);
				this.curr = child;
			} else {
				this.pending.add(child);
				this.childIndexStack.set(top, currIndex + 1);
			}
		} else {
			this.emit(this.curr);
			if (this.curr == this.start) {
				this.done = true;
			} else {
				this.curr = this.curr.parent;
				this.childIndexStack.removeAt(top);
				this.childIndexStack.set(top - 1, this.childIndexStack.get(top - 1) + 1);
			}
		}
	}

	private void emit(TreeNode n) {
		if (this.includeSelf || n != this.start) {
			this.pending.add(n);
		}
	}
}
