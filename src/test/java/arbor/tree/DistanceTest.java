package arbor.tree;

import static arbor.tree.TreeFixtures.node;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import arbor.exceptions.MissingNodeException;
import arbor.exceptions.NoLengthException;
import arbor.exceptions.NoParentException;

public class DistanceTest {

	private static final double EPS = 1e-9;

	protected TreeNode root;
	protected TreeNode a;
	protected TreeNode b;
	protected TreeNode c;

	/**
	 * (A:1,(B:1,C:1):1):0;
	 */
	@Before
	public void buildTree() {
		root = TreeFixtures.example();
		a = root.find("A");
		b = root.find("B");
		c = root.find("C");
	}

	@Test
	public void testDistance() {
		assertEquals(3.0, a.distance(b), EPS);
		assertEquals(3.0, b.distance(a), EPS);
		assertEquals(2.0, b.distance(c), EPS);
		assertEquals(1.0, b.distance(b.getParent()), EPS);
		assertEquals(1.0, a.distance(root), EPS);
	}

	@Test
	public void testDistanceToSelf() {
		assertEquals(0.0, a.distance(a), 0.0);
		assertEquals(0.0, root.distance(root), 0.0);
	}

	@Test
	public void testAccumulateToAncestor() {
		assertEquals(2.0, b.accumulateToAncestor(root), EPS);
		assertEquals(1.0, b.accumulateToAncestor(b.getParent()), EPS);
		assertEquals(0.0, b.accumulateToAncestor(b), 0.0);
	}

	@Test(expected = NoParentException.class)
	public void testAccumulateToNonAncestor() {
		b.accumulateToAncestor(a);
	}

	@Test(expected = NoLengthException.class)
	public void testDistanceNeedsLengths() {
		b.getParent().setLength(null);
		a.distance(c);
	}

	@Test
	public void testDistanceWithoutCrossingUnknownLength() {
		root.setLength(null);
		b.getParent().setLength(null);
		// the path B-C does not use the unknown branches
		assertEquals(2.0, b.distance(c), EPS);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDistanceAcrossTrees() {
		a.distance(TreeFixtures.example().find("B"));
	}

	@Test
	public void testMaxDistance() {
		MaxDistance max = root.getMaxDistance();
		assertEquals(3.0, max.getDistance(), EPS);
		assertSame(a, max.getTipA());
		assertSame(b, max.getTipB());
	}

	@Test
	public void testMaxDistanceUnbalanced() {
		TreeNode t = node("r",
				node("x", 1.0, node("a", 2.0), node("b", 5.0)),
				node("y", 10.0, node("c", 1.0), node("d", 1.0)));
		MaxDistance max = t.getMaxDistance();
		assertEquals(17.0, max.getDistance(), EPS);
		assertEquals("b", max.getTipA().getName());
		assertEquals("c", max.getTipB().getName());
		assertEquals(max.getDistance(), max.getTipA().distance(max.getTipB()), EPS);
	}

	@Test
	public void testMaxDistanceInsideSubtree() {
		// the longest path does not pass through the root
		TreeNode t = node("r",
				node("x", 0.5, node("a", 10.0), node("b", 10.0)),
				node("c", 1.0));
		MaxDistance max = t.getMaxDistance();
		assertEquals(20.0, max.getDistance(), EPS);
		assertEquals("a", max.getTipA().getName());
		assertEquals("b", max.getTipB().getName());
	}

	@Test
	public void testMaxDistanceThroughSingleChild() {
		TreeNode t = node("r",
				node("u", 2.0, node("x", 3.0, node("a", 1.0), node("b", 1.0))),
				node("c", 1.0));
		MaxDistance max = t.getMaxDistance();
		assertEquals(7.0, max.getDistance(), EPS);
		assertEquals("a", max.getTipA().getName());
		assertEquals("c", max.getTipB().getName());
	}

	@Test
	public void testMaxDistanceTreatsUnknownAsZero() {
		TreeNode t = node("r", node("a", 2.0), node("b"), node("c", 1.0));
		MaxDistance max = t.getMaxDistance();
		assertEquals(3.0, max.getDistance(), EPS);
		assertEquals("a", max.getTipA().getName());
		assertEquals("c", max.getTipB().getName());
	}

	@Test
	public void testMaxDistanceTiePrefersNodeNearerTop() {
		// a-b through x and a-c through r are both 2
		TreeNode t = node("r",
				node("x", 0.0, node("a", 1.0), node("b", 1.0)),
				node("c", 1.0));
		MaxDistance max = t.getMaxDistance();
		assertEquals(2.0, max.getDistance(), EPS);
		assertEquals("a", max.getTipA().getName());
		assertEquals("c", max.getTipB().getName());
	}

	@Test
	public void testMaxDistanceWithoutBranching() {
		MaxDistance max = node("r", node("a", 4.0)).getMaxDistance();
		assertEquals(0.0, max.getDistance(), 0.0);
		assertNull(max.getTipA());
		assertNull(max.getTipB());
	}

	@Test
	public void testTipTipDistances() {
		TipDistances td = root.tipTipDistances();
		assertEquals(Arrays.asList(a, b, c), td.getTipOrder());
		double[][] expected = {{0, 3, 3}, {3, 0, 2}, {3, 2, 0}};
		for (int i = 0; i < 3; i++) {
			assertArrayEquals(expected[i], td.getMatrix()[i], EPS);
		}
	}

	@Test
	public void testTipTipDistancesCountEdges() {
		TreeNode t = node("root",
				node("c", node("a"), node("b"), node("g", node("h"), node("i"))),
				node("f", node("d"), node("e")),
				node("j"));
		TipDistances td = t.tipTipDistances();
		List<TreeNode> order = td.getTipOrder();
		assertEquals(Arrays.asList("a", "b", "h", "i", "d", "e", "j"), TreeFixtures.names(order));
		for (int i = 0; i < td.size(); i++) {
			assertEquals(0.0, td.get(i, i), 0.0);
			for (int j = 0; j < td.size(); j++) {
				assertEquals(td.get(i, j), td.get(j, i), 0.0);
				if (i != j) {
					// no lengths at all, so each edge counts 1 and distance() is not usable;
					// count the edges through the common ancestor instead
					TreeNode lca = t.lowestCommonAncestorOfNodes(Arrays.asList(order.get(i), order.get(j)));
					int edges = depthBelow(order.get(i), lca) + depthBelow(order.get(j), lca);
					assertEquals(edges, td.get(i, j), EPS);
				}
			}
		}
	}

	private static int depthBelow(TreeNode n, TreeNode ancestor) {
		int d = 0;
		for (TreeNode curr = n; curr != ancestor; curr = curr.getParent()) {
			d++;
		}
		return d;
	}

	@Test
	public void testTipTipDistancesDefaultLength() {
		b.getParent().setLength(null);
		TipDistances td = root.tipTipDistances(null, 5.0);
		assertEquals(7.0, td.get(0, 1), EPS);
		assertEquals(2.0, td.get(1, 2), EPS);
	}

	@Test
	public void testTipTipDistancesEndpoints() {
		TipDistances td = root.tipTipDistances(Arrays.asList("C", "A"), TreeNode.DEFAULT_LENGTH);
		assertEquals(Arrays.asList(c, a), td.getTipOrder());
		assertEquals(2, td.getMatrix().length);
		assertEquals(0.0, td.get(0, 0), 0.0);
		assertEquals(3.0, td.get(0, 1), EPS);
		assertEquals(3.0, td.get(1, 0), EPS);
	}

	@Test(expected = MissingNodeException.class)
	public void testTipTipDistancesMissingName() {
		root.tipTipDistances(Arrays.asList("A", "Q"), TreeNode.DEFAULT_LENGTH);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testTipTipDistancesInternalEndpoint() {
		root.tipTipDistancesOfNodes(Arrays.asList(a, b.getParent()), TreeNode.DEFAULT_LENGTH);
	}

	@Test
	public void testTipTipDistancesOnSubtree() {
		TipDistances td = b.getParent().tipTipDistances();
		assertEquals(Arrays.asList(b, c), td.getTipOrder());
		assertEquals(2.0, td.get(0, 1), EPS);
	}

	@Test
	public void testTipTipDistancesOfTip() {
		assertEquals(0, a.tipTipDistances().size());
	}

	@Test
	public void testDeepTreeDistances() {
		TreeNode deep = TreeFixtures.caterpillar(5000);
		TreeNode t0 = deep.find("t0");
		TreeNode t5000 = deep.find("t5000");
		assertEquals(5001.0, t0.distance(t5000), EPS);
		assertEquals(5001.0, deep.getMaxDistance().getDistance(), EPS);
	}
}
