package spml.cst;

import spml.util.Span;

/**
 * Funnels all traversal of a {@link SyntaxTree} through one classification, so every parse routine sees the same
 * error vocabulary.
 */
public class TreeWalker {
	private final SyntaxTree tree;
	private final TreeCursor cursor;

	public TreeWalker(SyntaxTree tree) {
		this.tree = tree;
		this.cursor = tree.walk();
	}

	/**
	 * Attempts the movement and classifies the node arrived at. Missing placeholders take priority over error
	 * nodes, which take priority over extra nodes.
	 */
	public NodeMovingResult move(NodeMovement movement) {
		boolean moved;
		switch (movement) {
			case FIRST_CHILD:
				moved = cursor.gotoFirstChild();
				break;
			case NEXT_SIBLING:
				moved = cursor.gotoNextSibling();
				break;
			case CURRENT:
				moved = true;
				break;
			default:
				throw new IllegalArgumentException("unknown movement " + movement);
		}
		if (!moved) {
			return NodeMovingResult.nonExistent();
		}
		return NodeMovingResult.classify(cursor.node());
	}

	public SyntaxNode node() {
		return cursor.node();
	}

	public int depth() {
		return cursor.depth();
	}

	public boolean gotoFirstChild() {
		return cursor.gotoFirstChild();
	}

	public boolean gotoNextSibling() {
		return cursor.gotoNextSibling();
	}

	public boolean gotoParent() {
		return cursor.gotoParent();
	}

	public TreeCursor.Mark mark() {
		return cursor.mark();
	}

	public SyntaxTree getTree() {
		return tree;
	}

	public String text(SyntaxNode node) {
		return tree.textOf(node);
	}

	public static Span span(SyntaxNode node) {
		return Span.between(node.getStartPosition(), node.getEndPosition());
	}
}
