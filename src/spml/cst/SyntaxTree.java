package spml.cst;

import spml.util.LineIndex;

public class SyntaxTree {
	private final String text;
	private final SyntaxNode root;
	private final LineIndex lineIndex;

	public SyntaxTree(String text, SyntaxNode root) {
		this.text = text;
		this.root = root;
		this.lineIndex = new LineIndex(text);
	}

	public String getText() {
		return text;
	}

	public SyntaxNode getRoot() {
		return root;
	}

	public LineIndex getLineIndex() {
		return lineIndex;
	}

	public String textOf(SyntaxNode node) {
		return text.substring(node.getStartOffset(), node.getEndOffset());
	}

	public TreeCursor walk() {
		return new TreeCursor(root);
	}
}
