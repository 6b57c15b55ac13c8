package arbor.tree;

import java.util.Collections;
import java.util.List;

/**
 * Symmetric tip by tip distance matrix. Row and column i belong to getTipOrder().get(i).
 */
public class TipDistances {

	private final double[][] matrix;
	private final List<TreeNode> tipOrder;

	TipDistances(double[][] matrix, List<TreeNode> tipOrder) {
		this.matrix = matrix;
		this.tipOrder = Collections.unmodifiableList(tipOrder);
	}

	public double[][] getMatrix(){return this.matrix;}

	public List<TreeNode> getTipOrder(){return this.tipOrder;}

	public int size(){return this.tipOrder.size();}

	/**
	 * @return distance between the tips in rows i and j
	 */
	public double get(int i, int j){return this.matrix[i][j];}
}
