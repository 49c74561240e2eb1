package spml.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * A mutable position inside a {@link SyntaxTree}. The cursor is shared by a whole recursive descent; every routine
 * that descends takes a {@link Mark} first and closes it before it returns, which walks the cursor back up to the
 * depth the routine started at.
 */
public class TreeCursor {
	private final List<SyntaxNode> path = new ArrayList<>();
	private final List<Integer> indices = new ArrayList<>();

	public TreeCursor(SyntaxNode root) {
		path.add(root);
		indices.add(0);
	}

	public SyntaxNode node() {
		return path.get(path.size() - 1);
	}

	/**
	 * @return the number of first-child moves between the root and the current node
	 */
	public int depth() {
		return path.size() - 1;
	}

	public boolean gotoFirstChild() {
		List<SyntaxNode> children = node().getChildren();
		if (children.isEmpty()) {
			return false;
		}
		path.add(children.get(0));
		indices.add(0);
		return true;
	}

	public boolean gotoNextSibling() {
		if (depth() == 0) {
			return false;
		}
		List<SyntaxNode> siblings = path.get(path.size() - 2).getChildren();
		int next = indices.get(indices.size() - 1) + 1;
		if (next >= siblings.size()) {
			return false;
		}
		path.set(path.size() - 1, siblings.get(next));
		indices.set(indices.size() - 1, next);
		return true;
	}

	public boolean gotoParent() {
		if (depth() == 0) {
			return false;
		}
		path.remove(path.size() - 1);
		indices.remove(indices.size() - 1);
		return true;
	}

	public Mark mark() {
		return new Mark(depth());
	}

	/**
	 * Restores the depth the cursor had when the mark was taken. Sibling moves made at that depth are kept.
	 */
	public class Mark implements AutoCloseable {
		private final int depth;

		private Mark(int depth) {
			this.depth = depth;
		}

		public int getDepth() {
			return depth;
		}

		@Override
		public void close() {
			while (depth() > depth) {
				gotoParent();
			}
		}
	}
}
