package arbor.tree;

/**
 * Internal nodes only, in preorder.
 */
class NonTipIterator extends NodeIterator {

	private final PreorderIterator nodes;

	NonTipIterator(TreeNode start, boolean includeSelf) {
		super(start, includeSelf);
		this.nodes = new PreorderIterator(start, includeSelf);
	}

	@Override
	protected TreeNode advance() {
		while (this.nodes.hasNext()) {
			TreeNode n = this.nodes.next();
			if (n.isInternal()) {
				return n;
			}
		}
		return null;
	}
}
