package arbor.tree;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base for the lazy tree walks. Subclasses produce one node per call to advance() and
 * return null once the walk is finished.
 */
abstract class NodeIterator implements Iterator<TreeNode> {

	protected final TreeNode start;
	protected final boolean includeSelf;
	private TreeNode nextToReturn;
	private boolean finished;

	NodeIterator(TreeNode start, boolean includeSelf) {
		this.start = start;
		this.includeSelf = includeSelf;
		this.nextToReturn = null;
		this.finished = false;
	}

	/**
	 * @return the next node of the walk, or null when there is none left
	 */
	protected abstract TreeNode advance();

	public boolean hasNext() {
		if (this.nextToReturn == null && !this.finished) {
			this.nextToReturn = this.advance();
			if (this.nextToReturn == null) {
				this.finished = true;
			}
		}
		return this.nextToReturn != null;
	}

	public TreeNode next() {
		if (!this.hasNext()) {
			throw new NoSuchElementException();
		}
		TreeNode n = this.nextToReturn;
		this.nextToReturn = null;
		return n;
	}

	public void remove() {
		throw new UnsupportedOperationException();
	}
}
