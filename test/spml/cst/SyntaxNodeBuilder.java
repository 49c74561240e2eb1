package spml.cst;

import spml.util.LineIndex;

/**
 * Builds syntax trees by hand, for feeding the parsers shapes the reference builder never produces. Offsets are
 * character offsets into the text given at construction.
 */
public class SyntaxNodeBuilder {
	private final String text;
	private final LineIndex lines;

	public SyntaxNodeBuilder(String text) {
		this.text = text;
		this.lines = new LineIndex(text);
	}

	/**
	 * @return the offset of the first occurrence of needle
	 */
	public int at(String needle) {
		int offset = text.indexOf(needle);
		if (offset < 0) {
			throw new IllegalArgumentException("\"" + needle + "\" does not occur in the text");
		}
		return offset;
	}

	public SyntaxNode node(String kind, int start, int end, SyntaxNode... children) {
		TreeNode node = new TreeNode(kind, start, lines.positionOf(start));
		node.finish(end, lines.positionOf(end));
		for (SyntaxNode child : children) {
			node.add((TreeNode) child);
		}
		return node;
	}

	/**
	 * A node spanning the first occurrence of its own text.
	 */
	public SyntaxNode token(String kind, String tokenText) {
		int start = at(tokenText);
		return node(kind, start, start + tokenText.length());
	}

	public SyntaxNode missing(String kind, int at) {
		return ((TreeNode) node(kind, at, at)).markMissing();
	}

	public SyntaxNode extra(String kind, int start, int end, SyntaxNode... children) {
		return ((TreeNode) node(kind, start, end, children)).markExtra();
	}

	public SyntaxNode error(int start, int end, SyntaxNode... children) {
		return ((TreeNode) node("ERROR", start, end, children)).markError();
	}

	public SyntaxTree tree(SyntaxNode root) {
		return new SyntaxTree(text, root);
	}
}
