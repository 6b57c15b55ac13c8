package arbor.tree;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import org.apache.commons.lang3.Validate;
import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import arbor.exceptions.DuplicateNodeException;
import arbor.exceptions.MissingNodeException;
import arbor.exceptions.NoLengthException;
import arbor.exceptions.NoParentException;
import arbor.stats.DistanceFromR;
import arbor.stats.MatrixDistance;

/**
 * A node of a rooted tree with any number of ordered children. Each node carries an
 * optional name and an optional length of the branch leading to its parent; a null length
 * means the length is unknown, which is not the same as zero.
 *
 * Every walk over the tree uses an explicit stack or queue, so trees with thousands of
 * levels are handled without recursion. The one exception is {@link #asciiArt}.
 */
public class TreeNode implements Iterable<TreeNode> {
	static Logger _LOG = Logger.getLogger(TreeNode.class);

	/** branch length used for unknown lengths when building tip to tip distances */
	public static final double DEFAULT_LENGTH = 1.0;

	private static final Pattern NEWICK_QUOTE_CHARS = Pattern.compile("[\\]\\['\"(),:;_]");

	// bumped by every structural change or rename; a name cache built under an older
	// value is stale
	private static final AtomicLong MODIFICATIONS = new AtomicLong();

	/*
	 * common associations
	 */
	private String name;
	private Double length;
	TreeNode parent;
	final ArrayList<TreeNode> children;
	private final LinkedHashMap<String, Object> assoc;
	private HashMap<String, TreeNode> nodeCache; // name -> node over this subtree, rebuilt lazily
	private long cacheStamp;

	/*
	 * constructors
	 */
	public TreeNode() {
		this(null, null);
	}

	public TreeNode(String name) {
		this(name, null);
	}

	public TreeNode(String name, Double length) {
		checkLength(length);
		this.name = name;
		this.length = length;
		this.parent = null;
		this.children = new ArrayList<TreeNode>();
		this.assoc = new LinkedHashMap<String, Object>();
		this.nodeCache = new HashMap<String, TreeNode>();
	}

	/*
	 * accessors
	 */

	public String getName(){return this.name;}

	/**
	 * Renaming makes every name cache built so far stale.
	 */
	public void setName(String s) {
		this.name = s;
		invalidateCaches();
	}

	/**
	 * @return the length of the branch to the parent, or null if unknown
	 */
	public Double getLength(){return this.length;}

	public void setLength(Double length) {
		checkLength(length);
		this.length = length;
	}

	public TreeNode getParent(){return this.parent;}

	/**
	 * @return read-only view of the children; use append, extend, pop and remove to change them
	 */
	public List<TreeNode> getChildren(){return Collections.unmodifiableList(this.children);}

	/**
	 * @return the c-th child or throw IndexOutOfBoundsException.
	 */
	public TreeNode getChild(int c) throws IndexOutOfBoundsException {
		return this.children.get(c);
	}

	public int getChildCount(){return this.children.size();}

	public boolean isTip(){return this.children.isEmpty();}

	public boolean isInternal(){return !this.children.isEmpty();}

	public boolean isRoot(){return this.parent == null;}

	public Iterator<TreeNode> iterator(){return this.getChildren().iterator();}

	/**
	 * Adds or replaces a mapping of key->obj for this node. Associated objects are copied
	 * along with the node by {@link #copy()}.
	 */
	public void assocObject(String key, Object obj){this.assoc.put(key, obj);}

	/**
	 * @return Object associated with this node and key through a previous call to
	 *		assocObject, or null
	 */
	public Object getObject(String key){return this.assoc.get(key);}

	private static void checkLength(Double length) {
		if (length != null) {
			Validate.isTrue(!length.isNaN() && !length.isInfinite() && length >= 0.0,
					"branch length must be a finite non-negative number, got %s", length);
		}
	}

	/* ---------------------------- topology ---------------------------- */

	/**
	 * Detaches node from its current parent and makes this node its parent. Does not add
	 * node to this.children; every structural change goes through here.
	 */
	private TreeNode adopt(TreeNode node) {
		Validate.notNull(node, "node must not be null");
		// a tip can only be an ancestor of this node by being this node
		if (node == this || (node.isInternal() && isAncestorOf(node, this))) {
			throw new IllegalArgumentException("cannot adopt a node that is this node or one of its ancestors");
		}
		if (node.parent != null) {
			node.parent.remove(node);
		}
		node.parent = this;
		invalidateCaches();
		return node;
	}

	private static boolean isAncestorOf(TreeNode ancestor, TreeNode node) {
		for (TreeNode a = node.parent; a != null; a = a.parent) {
			if (a == ancestor) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Adds node as the last child of this node, detaching it from any previous parent.
	 */
	public void append(TreeNode node) {
		this.children.add(this.adopt(node));
	}

	/**
	 * Appends each of nodes in order.
	 */
	public void extend(Iterable<TreeNode> nodes) {
		// copy first, nodes may be a view of a child list that adoption changes
		ArrayList<TreeNode> toAdd = new ArrayList<TreeNode>();
		for (TreeNode n : nodes) {
			toAdd.add(n);
		}
		for (TreeNode n : toAdd) {
			this.append(n);
		}
	}

	private void insert(int index, TreeNode node) {
		this.children.add(index, this.adopt(node));
	}

	/**
	 * Detaches and returns the last child.
	 */
	public TreeNode pop() {
		return this.pop(this.children.size() - 1);
	}

	/**
	 * Detaches and returns the child at index.
	 */
	public TreeNode pop(int index) {
		TreeNode node = this.children.remove(index);
		node.parent = null;
		invalidateCaches();
		return node;
	}

	/**
	 * Detaches node if it is a child of this node (compared by identity).
	 * @return false if node is not a child of this node
	 */
	public boolean remove(TreeNode node) {
		for (int i = 0; i < this.children.size(); i++) {
			if (this.children.get(i) == node) {
				this.pop(i);
				return true;
			}
		}
		return false;
	}

	/**
	 * Detaches every descendant for which f holds. The descendants are collected before
	 * anything is removed, so f sees each of them exactly once.
	 */
	public void removeDeleted(Predicate<TreeNode> f) {
		ArrayList<TreeNode> snapshot = new ArrayList<TreeNode>();
		for (TreeNode n : this.preorder(false)) {
			snapshot.add(n);
		}
		int removed = 0;
		for (TreeNode n : snapshot) {
			if (f.test(n)) {
				n.parent.remove(n);
				removed++;
			}
		}
		_LOG.debug("removed " + removed + " of " + snapshot.size() + " descendants");
	}

	/**
	 * Removes every descendant that has exactly one child, putting that child where the
	 * removed node was. Branch lengths are left as they are.
	 */
	public void prune() {
		// collect first so that the topology is not altered while traversing
		ArrayList<TreeNode> toCollapse = new ArrayList<TreeNode>();
		for (TreeNode n : this.preorder(false)) {
			if (n.children.size() == 1) {
				toCollapse.add(n);
			}
		}
		for (TreeNode n : toCollapse) {
			TreeNode p = n.parent;
			int index = p.children.indexOf(n);
			p.insert(index, n.children.get(0));
			p.remove(n);
		}
		_LOG.debug("pruned " + toCollapse.size() + " single child nodes");
	}

	/* ---------------------------- traversal ---------------------------- */

	/**
	 * Depth first traversal of this subtree.
	 *
	 * @param selfBefore report each node before its descendants
	 * @param selfAfter report each node after its descendants
	 * @param includeSelf report this node as well
	 * @return the nodes in preorder, postorder or both; tips only if neither flag is set
	 */
	public Iterable<TreeNode> traverse(boolean selfBefore, boolean selfAfter, boolean includeSelf) {
		if (selfBefore) {
			return selfAfter ? this.preAndPostorder(includeSelf) : this.preorder(includeSelf);
		}
		return selfAfter ? this.postorder(includeSelf) : this.tips(includeSelf);
	}

	public Iterable<TreeNode> traverse() {
		return this.traverse(true, false, true);
	}

	public Iterable<TreeNode> preorder(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new PreorderIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> preorder() {
		return this.preorder(true);
	}

	public Iterable<TreeNode> postorder(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new PostorderIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> postorder() {
		return this.postorder(true);
	}

	/**
	 * Internal nodes are reported before their first child and again after their last;
	 * tips are reported once.
	 */
	public Iterable<TreeNode> preAndPostorder(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new PrePostorderIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> preAndPostorder() {
		return this.preAndPostorder(true);
	}

	public Iterable<TreeNode> levelorder(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new LevelorderIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> levelorder() {
		return this.levelorder(true);
	}

	/**
	 * @return the tips below this node; nothing if this node is a tip, unless includeSelf
	 */
	public Iterable<TreeNode> tips(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new TipIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> tips() {
		return this.tips(false);
	}

	/**
	 * @return the internal nodes below this node in preorder, this node too if includeSelf
	 *		and it is internal
	 */
	public Iterable<TreeNode> nonTips(final boolean includeSelf) {
		final TreeNode self = this;
		return new Iterable<TreeNode>() {
			public Iterator<TreeNode> iterator() {
				return new NonTipIterator(self, includeSelf);
			}
		};
	}

	public Iterable<TreeNode> nonTips() {
		return this.nonTips(false);
	}

	/* ---------------------------- name lookup ---------------------------- */

	public void invalidateNodeCache() {
		this.nodeCache = new HashMap<String, TreeNode>();
	}

	// every cache built before this call is treated as stale by createNodeCache, which
	// covers the caches of all subtrees containing the change in constant time
	private static void invalidateCaches() {
		MODIFICATIONS.incrementAndGet();
	}

	/**
	 * Builds the name -> node lookup for this subtree unless it is already built. Nodes
	 * without a name are not indexed.
	 *
	 * @throws DuplicateNodeException if two nodes share a name; the cache stays empty
	 */
	public void createNodeCache() {
		long stamp = MODIFICATIONS.get();
		if (!this.nodeCache.isEmpty() && this.cacheStamp == stamp) {
			return;
		}
		this.nodeCache = new HashMap<String, TreeNode>();
		HashMap<String, TreeNode> cache = new HashMap<String, TreeNode>();
		for (TreeNode n : this.preorder(true)) {
			if (n.name == null) {
				continue;
			}
			if (cache.containsKey(n.name)) {
				throw new DuplicateNodeException(n.name);
			}
			cache.put(n.name, n);
		}
		this.nodeCache = cache;
		this.cacheStamp = stamp;
		_LOG.debug("built node cache with " + cache.size() + " names");
	}

	/**
	 * @return node itself
	 */
	public TreeNode find(TreeNode node) {
		return node;
	}

	/**
	 * Finds the node called name in this subtree. The first call builds the name cache.
	 *
	 * @throws MissingNodeException if there is no such node
	 * @throws DuplicateNodeException if the cache has to be built and names clash
	 */
	public TreeNode find(String name) {
		this.createNodeCache();
		TreeNode node = this.nodeCache.get(name);
		if (node == null) {
			throw new MissingNodeException(name);
		}
		return node;
	}

	private List<TreeNode> findAll(List<String> names) {
		this.createNodeCache();
		ArrayList<TreeNode> found = new ArrayList<TreeNode>();
		ArrayList<String> missing = new ArrayList<String>();
		for (String n : names) {
			TreeNode node = this.nodeCache.get(n);
			if (node == null) {
				missing.add(n);
			} else {
				found.add(node);
			}
		}
		if (!missing.isEmpty()) {
			throw new MissingNodeException(missing);
		}
		return found;
	}

	/* ---------------------------- paths ---------------------------- */

	/**
	 * @return parent, grandparent, ... up to the root; empty for the root
	 */
	public List<TreeNode> ancestors() {
		ArrayList<TreeNode> result = new ArrayList<TreeNode>();
		for (TreeNode curr = this.parent; curr != null; curr = curr.parent) {
			result.add(curr);
		}
		return result;
	}

	public TreeNode root() {
		TreeNode curr = this;
		while (curr.parent != null) {
			curr = curr.parent;
		}
		return curr;
	}

	/**
	 * @return the other children of this node's parent; empty for the root
	 */
	public List<TreeNode> siblings() {
		ArrayList<TreeNode> result = new ArrayList<TreeNode>();
		if (this.parent != null) {
			for (TreeNode n : this.parent.children) {
				if (n != this) {
					result.add(n);
				}
			}
		}
		return result;
	}

	/**
	 * Lowest common ancestor of the named nodes of this subtree.
	 *
	 * @throws MissingNodeException naming every name that is not in this subtree
	 */
	public TreeNode lowestCommonAncestor(List<String> names) {
		Validate.notEmpty(names, "at least one name is needed");
		if (names.size() == 1) {
			return this.find(names.get(0));
		}
		return this.lowestCommonAncestorOfNodes(this.findAll(names));
	}

	/**
	 * Lowest common ancestor of nodes, all of which must be in this subtree.
	 *
	 * Each node walks up towards this node, marking every ancestor it passes with the child
	 * it came from. A walk stops as soon as it reaches an ancestor marked by an earlier walk,
	 * adding its own child to that ancestor's marks. The answer is then found by descending
	 * from this node along single marks; the first node with two or more marks, or that is
	 * itself one of the queried nodes, is the ancestor. For k nodes in a balanced tree of
	 * height h this touches O(h sqrt(k)) nodes. Marks live in a map local to the call.
	 *
	 * @throws IllegalArgumentException if a node is not in this subtree
	 */
	public TreeNode lowestCommonAncestorOfNodes(List<TreeNode> nodes) {
		Validate.notEmpty(nodes, "at least one node is needed");
		LinkedHashSet<TreeNode> targets = new LinkedHashSet<TreeNode>(nodes);
		if (targets.contains(this)) {
			for (TreeNode t : targets) {
				checkDescendant(t);
			}
			return this;
		}
		IdentityHashMap<TreeNode, List<TreeNode>> hits = new IdentityHashMap<TreeNode, List<TreeNode>>();
		for (TreeNode t : targets) {
			Validate.notNull(t, "node must not be null");
			TreeNode prev = t;
			TreeNode curr = t.parent;
			while (true) {
				if (curr == null) {
					throw new IllegalArgumentException("node " + t.name + " is not below " + this.name);
				}
				List<TreeNode> marks = hits.get(curr);
				if (marks != null) {
					// reached from a second direction, unless prev is a queried node that an
					// earlier walk already passed through
					if (!marks.contains(prev)) {
						marks.add(prev);
					}
					break;
				}
				marks = new ArrayList<TreeNode>(2);
				marks.add(prev);
				hits.put(curr, marks);
				if (curr == this) {
					break;
				}
				prev = curr;
				curr = curr.parent;
			}
		}
		TreeNode curr = this;
		while (!targets.contains(curr)) {
			List<TreeNode> marks = hits.get(curr);
			if (marks == null || marks.size() != 1) {
				break;
			}
			curr = marks.get(0);
		}
		return curr;
	}

	private void checkDescendant(TreeNode node) {
		Validate.notNull(node, "node must not be null");
		for (TreeNode a = node; a != null; a = a.parent) {
			if (a == this) {
				return;
			}
		}
		throw new IllegalArgumentException("node " + node.name + " is not below " + this.name);
	}

	/* ---------------------------- distances ---------------------------- */

	/**
	 * @return sum of the branch lengths from this node up to, not including, ancestor
	 * @throws NoParentException if ancestor is not on the path to the root
	 * @throws NoLengthException if a branch on the way has no length
	 */
	double accumulateToAncestor(TreeNode ancestor) {
		double accum = 0.0;
		TreeNode curr = this;
		while (curr != ancestor) {
			if (curr.parent == null) {
				throw new NoParentException("provided ancestor is not in the path");
			}
			if (curr.length == null) {
				throw new NoLengthException(curr.name);
			}
			accum += curr.length;
			curr = curr.parent;
		}
		return accum;
	}

	/**
	 * @return sum of the branch lengths on the path between this node and other
	 * @throws NoLengthException if a branch on the path has no length
	 * @throws IllegalArgumentException if other is in another tree
	 */
	public double distance(TreeNode other) {
		if (this == other) {
			return 0.0;
		}
		TreeNode lca = this.root().lowestCommonAncestorOfNodes(Arrays.asList(this, other));
		return this.accumulateToAncestor(lca) + other.accumulateToAncestor(lca);
	}

	/**
	 * Longest tip to tip path in this subtree, found in one postorder sweep. Every node keeps
	 * its two farthest tips reached through different children; unknown lengths count as
	 * zero here. When two children reach equally far the earlier child wins; when paths
	 * through two nodes are equally long the node nearer this one wins.
	 *
	 * @return the distance and the two end tips, in child order
	 */
	public MaxDistance getMaxDistance() {
		IdentityHashMap<TreeNode, TipReach[]> reach = new IdentityHashMap<TreeNode, TipReach[]>();
		// best path through each node with two or more children
		IdentityHashMap<TreeNode, MaxDistance> through = new IdentityHashMap<TreeNode, MaxDistance>();
		for (TreeNode n : this.postorder(true)) {
			if (n.isTip()) {
				TipReach self = new TipReach(0.0, n);
				reach.put(n, new TipReach[] {self, self});
				continue;
			}
			if (n.children.size() == 1) {
				TreeNode c = n.children.get(0);
				TipReach[] cr = reach.remove(c);
				double bl = lengthOrZero(c);
				reach.put(n, new TipReach[] {cr[0].extend(bl), cr[1].extend(bl)});
				continue;
			}
			int first = -1;
			int second = -1;
			TipReach firstReach = null;
			TipReach secondReach = null;
			for (int i = 0; i < n.children.size(); i++) {
				TreeNode c = n.children.get(i);
				TipReach r = reach.remove(c)[0].extend(lengthOrZero(c));
				if (first < 0 || r.distance > firstReach.distance) {
					second = first;
					secondReach = firstReach;
					first = i;
					firstReach = r;
				} else if (second < 0 || r.distance > secondReach.distance) {
					second = i;
					secondReach = r;
				}
			}
			reach.put(n, new TipReach[] {firstReach, secondReach});
			through.put(n, new MaxDistance(firstReach.distance + secondReach.distance,
					first < second ? firstReach.tip : secondReach.tip,
					first < second ? secondReach.tip : firstReach.tip));
		}
		// preorder, so on a tie the node nearest this one wins
		MaxDistance best = new MaxDistance(0.0, null, null);
		for (TreeNode n : this.nonTips(true)) {
			MaxDistance candidate = through.get(n);
			if (candidate != null && (best.getTipA() == null || candidate.getDistance() > best.getDistance())) {
				best = candidate;
			}
		}
		return best;
	}

	private static double lengthOrZero(TreeNode n) {
		return n.length == null ? 0.0 : n.length;
	}

	/** a tip and how far it is from the node holding this record */
	private static class TipReach {
		final double distance;
		final TreeNode tip;

		TipReach(double distance, TreeNode tip) {
			this.distance = distance;
			this.tip = tip;
		}

		TipReach extend(double bl) {
			return new TipReach(this.distance + bl, this.tip);
		}
	}

	/**
	 * @return distances between all tips of this subtree, unknown lengths counted as 1
	 */
	public TipDistances tipTipDistances() {
		return this.tipTipDistancesOfNodes(null, DEFAULT_LENGTH);
	}

	/**
	 * @param endpoints names of the tips to include, in row order; null for all tips
	 * @param defaultLength length used for branches with no length
	 */
	public TipDistances tipTipDistances(List<String> endpoints, double defaultLength) {
		if (endpoints == null) {
			return this.tipTipDistancesOfNodes(null, defaultLength);
		}
		return this.tipTipDistancesOfNodes(this.findAll(endpoints), defaultLength);
	}

	/**
	 * Distance matrix among the given tips, built in a single postorder sweep.
	 *
	 * The tips are numbered in postorder so that every node covers a contiguous range
	 * [start, stop) of tip numbers. distances[t] is the path length from tip t up to the node
	 * being visited; at each internal node every pair of tips lying below two different
	 * children is settled as distances[t1] + distances[t2].
	 *
	 * @param endpoints tips to include, in row order; null for all tips
	 * @param defaultLength length used for branches with no length
	 * @throws IllegalArgumentException if an endpoint is not a tip of this subtree
	 */
	public TipDistances tipTipDistancesOfNodes(List<TreeNode> endpoints, double defaultLength) {
		ArrayList<TreeNode> allTips = new ArrayList<TreeNode>();
		for (TreeNode t : this.tips()) {
			allTips.add(t);
		}
		List<TreeNode> tipOrder = endpoints == null ? allTips : new ArrayList<TreeNode>(endpoints);

		TObjectIntHashMap<TreeNode> start = new TObjectIntHashMap<TreeNode>();
		TObjectIntHashMap<TreeNode> stop = new TObjectIntHashMap<TreeNode>();
		for (int i = 0; i < allTips.size(); i++) {
			start.put(allTips.get(i), i);
			stop.put(allTips.get(i), i + 1);
		}
		// tip number -> row in the result
		TIntIntHashMap resultMap = new TIntIntHashMap();
		for (int i = 0; i < tipOrder.size(); i++) {
			TreeNode t = tipOrder.get(i);
			if (!start.containsKey(t)) {
				throw new IllegalArgumentException("node " + (t == null ? null : t.name) + " is not a tip below " + this.name);
			}
			resultMap.put(start.get(t), i);
		}

		double[][] result = new double[tipOrder.size()][tipOrder.size()];
		double[] distances = new double[allTips.size()];
		for (TreeNode node : this.postorder(true)) {
			if (node.isTip()) {
				continue;
			}
			int nodeStart = Integer.MAX_VALUE;
			int nodeStop = Integer.MIN_VALUE;
			for (TreeNode child : node.children) {
				double bl = child.length == null ? defaultLength : child.length;
				int s = start.get(child);
				int e = stop.get(child);
				for (int k = s; k < e; k++) {
					distances[k] += bl;
				}
				nodeStart = Math.min(nodeStart, s);
				nodeStop = Math.max(nodeStop, e);
			}
			start.put(node, nodeStart);
			stop.put(node, nodeStop);
			if (node.children.size() > 1) {
				settleCrossPairs(node, start, stop, resultMap, distances, result);
			}
		}
		return new TipDistances(result, tipOrder);
	}

	private static void settleCrossPairs(TreeNode node, TObjectIntHashMap<TreeNode> start, TObjectIntHashMap<TreeNode> stop,
			TIntIntHashMap resultMap, double[] distances, double[][] result) {
		List<TreeNode> kids = node.children;
		for (int a = 0; a < kids.size(); a++) {
			for (int b = a + 1; b < kids.size(); b++) {
				for (int tip1 = start.get(kids.get(a)); tip1 < stop.get(kids.get(a)); tip1++) {
					if (!resultMap.containsKey(tip1)) {
						continue;
					}
					int row = resultMap.get(tip1);
					for (int tip2 = start.get(kids.get(b)); tip2 < stop.get(kids.get(b)); tip2++) {
						if (!resultMap.containsKey(tip2)) {
							continue;
						}
						int col = resultMap.get(tip2);
						result[row][col] = distances[tip1] + distances[tip2];
						result[col][row] = result[row][col];
					}
				}
			}
		}
	}

	/* ---------------------------- formatting ---------------------------- */

	/**
	 * Newick representation of this subtree, written without recursion.
	 *
	 * @param withDistances append ":length" to nodes that have a branch length
	 * @param semicolon end the string with ';'
	 * @param escapeName quote names containing any of []'"(),:;_ and replace spaces
	 *		with '_' in the others
	 */
	public String toNewick(boolean withDistances, boolean semicolon, boolean escapeName) {
		StringBuilder result = new StringBuilder();
		ArrayList<TreeNode> nodeStack = new ArrayList<TreeNode>();
		TIntArrayList childIndexStack = new TIntArrayList();
		nodeStack.add(this);
		childIndexStack.add(0);
		if (this.isInternal()) {
			result.append('(');
		}
		while (!nodeStack.isEmpty()) {
			int top = nodeStack.size() - 1;
			TreeNode topNode = nodeStack.get(top);
			int next = childIndexStack.get(top);
			if (next < topNode.children.size()) {
				// pre-visit of the next child
				if (next > 0) {
					result.append(',');
				}
				childIndexStack.set(top, next + 1);
				TreeNode child = topNode.children.get(next);
				if (child.isInternal()) {
					result.append('(');
				}
				nodeStack.add(child);
				childIndexStack.add(0);
			} else {
				// post-visit
				nodeStack.remove(top);
				childIndexStack.removeAt(top);
				if (topNode.isInternal()) {
					result.append(')');
				}
				if (topNode.name != null) {
					result.append(escapeName ? newickName(topNode.name) : topNode.name);
				}
				if (withDistances && topNode.length != null) {
					result.append(':').append(formatLength(topNode.length));
				}
			}
		}
		if (semicolon) {
			result.append(';');
		}
		return result.toString();
	}

	public String toNewick() {
		return this.toNewick(false, true, true);
	}

	/**
	 * Names that are already single quoted are kept as they are.
	 */
	static String newickName(String name) {
		if (name.length() > 1 && name.startsWith("'") && name.endsWith("'")) {
			return name;
		}
		if (NEWICK_QUOTE_CHARS.matcher(name).find()) {
			return "'" + name.replace("'", "''") + "'";
		}
		return name.replace(' ', '_');
	}

	/**
	 * Plain decimal, no exponent and no trailing zeros: 1.0 -> "1", 0.25 -> "0.25".
	 */
	static String formatLength(double length) {
		return BigDecimal.valueOf(length).stripTrailingZeros().toPlainString();
	}

	/**
	 * Text drawing of this subtree.
	 *
	 * NOTE: recursive, not safe for very deep trees.
	 *
	 * @param showInternal write the names of internal nodes on their stems
	 * @param compact one line per tip, no blank lines between subtrees
	 */
	public String asciiArt(boolean showInternal, boolean compact) {
		return new AsciiArt(showInternal, compact).render(this);
	}

	public String asciiArt() {
		return this.asciiArt(true, false);
	}

	/**
	 * @param bl should be true to include branch lengths
	 * @return JSON object for this subtree: "name", "length" if requested and known, and
	 *		"children" for internal nodes
	 */
	@SuppressWarnings("unchecked")
	public JSONObject toJSON(boolean bl) {
		IdentityHashMap<TreeNode, JSONObject> built = new IdentityHashMap<TreeNode, JSONObject>();
		for (TreeNode n : this.postorder(true)) {
			JSONObject obj = new JSONObject();
			obj.put("name", n.name == null ? "" : n.name);
			if (bl && n.length != null) {
				obj.put("length", n.length);
			}
			if (n.isInternal()) {
				JSONArray kids = new JSONArray();
				for (TreeNode c : n.children) {
					kids.add(built.remove(c));
				}
				obj.put("children", kids);
			}
			built.put(n, obj);
		}
		return built.get(this);
	}

	/**
	 * @return Newick string with branch lengths
	 */
	@Override
	public String toString() {
		return this.toNewick(true, true, true);
	}

	/* ---------------------------- copy and compare ---------------------------- */

	/**
	 * Deep copy of this subtree, built without recursion. Names, lengths and associated
	 * objects are copied (the objects themselves are shared); the copy's root has no parent
	 * and its name cache starts empty.
	 */
	public TreeNode copy() {
		TreeNode root = this.copyNode();
		ArrayList<TreeNode> newStack = new ArrayList<TreeNode>();
		ArrayList<TreeNode> oldStack = new ArrayList<TreeNode>();
		TIntArrayList childIndexStack = new TIntArrayList();
		newStack.add(root);
		oldStack.add(this);
		childIndexStack.add(0);
		while (!oldStack.isEmpty()) {
			int top = oldStack.size() - 1;
			TreeNode oldTop = oldStack.get(top);
			int next = childIndexStack.get(top);
			if (next < oldTop.children.size()) {
				childIndexStack.set(top, next + 1);
				TreeNode oldChild = oldTop.children.get(next);
				TreeNode newChild = oldChild.copyNode();
				newStack.get(top).append(newChild);
				newStack.add(newChild);
				oldStack.add(oldChild);
				childIndexStack.add(0);
			} else {
				newStack.remove(top);
				oldStack.remove(top);
				childIndexStack.removeAt(top);
			}
		}
		return root;
	}

	/**
	 * @return a detached node with this node's name, length and associated objects
	 */
	protected TreeNode copyNode() {
		TreeNode n = new TreeNode(this.name, this.length);
		n.assoc.putAll(this.assoc);
		return n;
	}

	/**
	 * @return names of the tips below this node; empty for a tip
	 */
	public Set<String> subset() {
		HashSet<String> names = new HashSet<String>();
		for (TreeNode t : this.tips()) {
			names.add(t.name);
		}
		return names;
	}

	public double compareTipDistances(TreeNode other) {
		return this.compareTipDistances(other, null, new DistanceFromR(), new Random());
	}

	public double compareTipDistances(TreeNode other, Integer sample) {
		return this.compareTipDistances(other, sample, new DistanceFromR(), new Random());
	}

	/**
	 * Compares the tip to tip distances of this tree and other over the tip names they share.
	 * Names only present in one tree are ignored. Trees sharing two names or fewer, and
	 * samples of two names or fewer, are considered identical and score 1.
	 *
	 * @param sample if not null, compare only this many randomly chosen shared names; must
	 *		not be negative
	 * @param distF scores the two distance matrices, by default (1 - r) / 2
	 * @param random source for choosing the sample
	 * @throws IllegalArgumentException if the trees share no tip names
	 */
	public double compareTipDistances(TreeNode other, Integer sample, MatrixDistance distF, Random random) {
		LinkedHashMap<String, TreeNode> selfNames = tipsByName(this);
		LinkedHashMap<String, TreeNode> otherNames = tipsByName(other);
		List<String> commonNames = new ArrayList<String>();
		for (String n : selfNames.keySet()) {
			if (otherNames.containsKey(n)) {
				commonNames.add(n);
			}
		}
		if (commonNames.isEmpty()) {
			throw new IllegalArgumentException("No names in common between the two trees.");
		}
		if (sample != null) {
			Validate.isTrue(sample >= 0, "sample must not be negative, got %d", sample);
			Collections.shuffle(commonNames, random);
			commonNames = commonNames.subList(0, Math.min(sample, commonNames.size()));
		}
		// two tips give a single distance, too few to correlate
		if (commonNames.size() <= 2) {
			return 1.0;
		}
		_LOG.debug("comparing tip distances over " + commonNames.size() + " shared tips");

		ArrayList<TreeNode> selfNodes = new ArrayList<TreeNode>();
		ArrayList<TreeNode> otherNodes = new ArrayList<TreeNode>();
		for (String n : commonNames) {
			selfNodes.add(selfNames.get(n));
			otherNodes.add(otherNames.get(n));
		}
		double[][] selfMatrix = this.tipTipDistancesOfNodes(selfNodes, DEFAULT_LENGTH).getMatrix();
		double[][] otherMatrix = other.tipTipDistancesOfNodes(otherNodes, DEFAULT_LENGTH).getMatrix();
		return distF.distance(selfMatrix, otherMatrix);
	}

	private static LinkedHashMap<String, TreeNode> tipsByName(TreeNode n) {
		LinkedHashMap<String, TreeNode> names = new LinkedHashMap<String, TreeNode>();
		for (TreeNode t : n.tips()) {
			names.put(t.name, t);
		}
		return names;
	}
}
