package spml.cst;

import spml.util.Position;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The {@link SyntaxNode}s built by {@link SpmlTreeBuilder}. Nodes are mutable while the builder works on them and
 * are never modified after the tree is handed out.
 */
final class TreeNode implements SyntaxNode {
	private final String kind;
	private final int startOffset;
	private final Position startPosition;
	private int endOffset;
	private Position endPosition;
	private TreeNode parent;
	private final List<SyntaxNode> children = new ArrayList<>();
	private boolean missing;
	private boolean extra;
	private boolean error;

	TreeNode(String kind, int startOffset, Position startPosition) {
		this.kind = kind;
		this.startOffset = startOffset;
		this.startPosition = startPosition;
		this.endOffset = startOffset;
		this.endPosition = startPosition;
	}

	void finish(int endOffset, Position endPosition) {
		this.endOffset = endOffset;
		this.endPosition = endPosition;
	}

	TreeNode add(TreeNode child) {
		child.parent = this;
		children.add(child);
		return child;
	}

	void truncate(int childCount) {
		while (children.size() > childCount) {
			children.remove(children.size() - 1);
		}
	}

	int lastChildEnd() {
		if (children.isEmpty()) {
			return startOffset;
		}
		return children.get(children.size() - 1).getEndOffset();
	}

	TreeNode markMissing() {
		missing = true;
		return this;
	}

	TreeNode markExtra() {
		extra = true;
		return this;
	}

	TreeNode markError() {
		error = true;
		return this;
	}

	@Override
	public String getKind() {
		return kind;
	}

	@Override
	public Position getStartPosition() {
		return startPosition;
	}

	@Override
	public Position getEndPosition() {
		return endPosition;
	}

	@Override
	public int getStartOffset() {
		return startOffset;
	}

	@Override
	public int getEndOffset() {
		return endOffset;
	}

	@Override
	public SyntaxNode getParent() {
		return parent;
	}

	@Override
	public List<SyntaxNode> getChildren() {
		return Collections.unmodifiableList(children);
	}

	@Override
	public boolean isMissing() {
		return missing;
	}

	@Override
	public boolean isExtra() {
		return extra;
	}

	@Override
	public boolean isError() {
		return error;
	}

	@Override
	public boolean equals(Object o) {
		return this == o;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, startOffset, endOffset);
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		if (missing) {
			builder.append("MISSING ");
		}
		if (extra) {
			builder.append("EXTRA ");
		}
		builder.append(kind).append(" [").append(startPosition).append("-").append(endPosition).append("]");
		return builder.toString();
	}
}
