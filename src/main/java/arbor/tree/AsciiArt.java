package arbor.tree;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Box drawing of a subtree: every internal node fans its children out to the right with a
 * vertical bar joining the first and last child.
 *
 * Recursive, one call per node, so very deep trees can exhaust the call stack.
 */
class AsciiArt {

	private static final int LEN = 10;
	private static final String PAD = StringUtils.repeat(' ', LEN);
	private static final String PA = StringUtils.repeat(' ', LEN - 1);

	private final boolean showInternal;
	private final boolean compact;

	AsciiArt(boolean showInternal, boolean compact) {
		this.showInternal = showInternal;
		this.compact = compact;
	}

	String render(TreeNode node) {
		List<String> lines = new ArrayList<String>();
		this.draw(node, '-', lines);
		return StringUtils.join(lines, "\n");
	}

	/**
	 * Appends the lines of node's drawing to out.
	 * @return index within the appended lines of the row that carries node's stem
	 */
	private int draw(TreeNode node, char char1, List<String> out) {
		String namestr = node.getName() == null ? "" : node.getName();
		if (node.isTip()) {
			out.add(char1 + "-" + namestr);
			return 0;
		}
		List<String> result = new ArrayList<String>();
		List<Integer> mids = new ArrayList<Integer>();
		int last = node.getChildCount() - 1;
		for (int i = 0; i <= last; i++) {
			char char2;
			if (i == 0) {
				char2 = '/';
			} else if (i == last) {
				char2 = '\\';
			} else {
				char2 = '-';
			}
			int offset = result.size();
			int mid = this.draw(node.getChild(i), char2, result);
			mids.add(mid + offset);
			if (!this.compact) {
				result.add("");
			}
		}
		if (!this.compact) {
			result.remove(result.size() - 1);
		}
		int lo = mids.get(0);
		int hi = mids.get(mids.size() - 1);
		int mid = (lo + hi) / 2;
		for (int i = 0; i < result.size(); i++) {
			String prefix = (i > lo && i < hi) ? PA + "|" : PAD;
			if (i == mid) {
				prefix = char1 + StringUtils.repeat('-', LEN - 2) + prefix.charAt(prefix.length() - 1);
			}
			result.set(i, prefix + result.get(i));
		}
		if (this.showInternal) {
			String stem = result.get(mid);
			String rest = namestr.length() + 1 < stem.length() ? stem.substring(namestr.length() + 1) : "";
			result.set(mid, stem.charAt(0) + namestr + rest);
		}
		out.addAll(result);
		return mid;
	}
}
