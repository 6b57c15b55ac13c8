package arbor.tree;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import arbor.exceptions.MissingNodeException;

public class LowestCommonAncestorTest {

	protected TreeNode human;
	protected TreeNode chimp;
	protected TreeNode gorilla;
	protected TreeNode orang;
	protected TreeNode hcAnc;
	protected TreeNode hcgAnc;
	protected TreeNode hcgoAnc;

	/**
	 * (((human,chimp)hc_anc,gorilla)hcg_anc,orang)hcgo_anc;
	 */
	@Before
	public void buildTree() {
		human = new TreeNode("human");
		chimp = new TreeNode("chimp");
		gorilla = new TreeNode("gorilla");
		orang = new TreeNode("orang");
		hcAnc = TreeFixtures.node("hc_anc", human, chimp);
		hcgAnc = TreeFixtures.node("hcg_anc", hcAnc, gorilla);
		hcgoAnc = TreeFixtures.node("hcgo_anc", hcgAnc, orang);
	}

	@Test
	public void testAnc() {
		assertSame(hcAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "chimp")));
		assertSame(hcgAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "gorilla")));
		assertSame(hcgAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("chimp", "gorilla")));
		assertSame(hcgAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("gorilla", "chimp", "human")));
		assertSame(hcgoAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("gorilla", "orang")));
	}

	@Test
	public void testSingleTip() {
		assertSame(gorilla, hcgoAnc.lowestCommonAncestor(Arrays.asList("gorilla")));
		assertSame(gorilla, hcgoAnc.lowestCommonAncestorOfNodes(Arrays.asList(gorilla)));
	}

	@Test
	public void testAllTipsGiveRoot() {
		List<String> all = TreeFixtures.names(hcgoAnc.tips());
		assertSame(hcgoAnc, hcgoAnc.lowestCommonAncestor(all));
	}

	@Test
	public void testAncestorAmongTargets() {
		assertSame(hcAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "hc_anc")));
		assertSame(hcgAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("hc_anc", "gorilla", "chimp")));
		assertSame(hcgoAnc, hcgoAnc.lowestCommonAncestorOfNodes(Arrays.asList(hcgoAnc, chimp)));
	}

	@Test
	public void testRepeatedTarget() {
		assertSame(human, hcgoAnc.lowestCommonAncestorOfNodes(Arrays.asList(human, human)));
		assertSame(hcAnc, hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "chimp", "human")));
	}

	@Test
	public void testOnSubtree() {
		assertSame(hcAnc, hcgAnc.lowestCommonAncestor(Arrays.asList("human", "chimp")));
		assertSame(hcgAnc, hcgAnc.lowestCommonAncestorOfNodes(Arrays.asList(gorilla, human)));
	}

	@Test
	public void testMissingNames() {
		try {
			hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "bogus", "yeti"));
			fail("expected MissingNodeException");
		} catch (MissingNodeException e) {
			assertEquals(Arrays.asList("bogus", "yeti"), e.getMissingNames());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNodeOutsideSubtree() {
		hcgAnc.lowestCommonAncestorOfNodes(Arrays.asList(human, orang));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testDetachedNode() {
		hcgoAnc.lowestCommonAncestorOfNodes(Arrays.asList(human, new TreeNode("bogus")));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyQuery() {
		hcgoAnc.lowestCommonAncestor(new ArrayList<String>());
	}

	@Test
	public void testTreeUnchanged() {
		String before = hcgoAnc.toNewick(true, true, true);
		hcgoAnc.lowestCommonAncestor(Arrays.asList("human", "gorilla", "orang"));
		assertEquals(before, hcgoAnc.toNewick(true, true, true));
		assertSame(hcAnc, human.getParent());
		assertEquals(2, hcAnc.getChildCount());
	}

	@Test
	public void testDeepTree() {
		TreeNode deep = TreeFixtures.caterpillar(20000);
		assertSame(deep, deep.lowestCommonAncestor(Arrays.asList("t0", "t20000")));
		TreeNode n19990 = deep.find("n19990");
		assertSame(n19990, deep.lowestCommonAncestor(Arrays.asList("t19990", "t19999", "t20000")));
	}
}
