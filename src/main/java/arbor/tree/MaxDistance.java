package arbor.tree;

/**
 * The longest tip to tip path of a tree: its length and the two tips at its ends. Both
 * tips are null when the tree has no node with two or more children.
 */
public class MaxDistance {

	private final double distance;
	private final TreeNode tipA;
	private final TreeNode tipB;

	public MaxDistance(double distance, TreeNode tipA, TreeNode tipB) {
		this.distance = distance;
		this.tipA = tipA;
		this.tipB = tipB;
	}

	public double getDistance(){return this.distance;}

	public TreeNode getTipA(){return this.tipA;}

	public TreeNode getTipB(){return this.tipB;}

	@Override
	public String toString() {
		return this.distance + " (" + name(this.tipA) + ", " + name(this.tipB) + ")";
	}

	private static String name(TreeNode n) {
		return n == null ? "null" : n.getName();
	}
}
