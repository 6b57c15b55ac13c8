package arbor.stats;

/**
 * Scores how different two equally shaped distance matrices are. Used by
 * {@link arbor.tree.TreeNode#compareTipDistances} to compare two trees.
 */
public interface MatrixDistance {

	/**
	 * @param m1 first matrix
	 * @param m2 second matrix, same shape as m1
	 * @return dissimilarity of the two matrices
	 */
	public double distance(double[][] m1, double[][] m2);
}
