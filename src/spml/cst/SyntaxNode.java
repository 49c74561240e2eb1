package spml.cst;

import spml.util.Position;

import java.util.List;
import java.util.Optional;

/**
 * A node of a concrete syntax tree, as produced by a grammar oracle. The document parser relies on nothing but the
 * kind, the coordinates and the three recovery flags.
 */
public interface SyntaxNode {

	String getKind();

	Position getStartPosition();

	Position getEndPosition();

	int getStartOffset();

	int getEndOffset();

	/**
	 * @return the parent node, or null for the root
	 */
	SyntaxNode getParent();

	List<SyntaxNode> getChildren();

	/**
	 * @return true for zero-width placeholders of required tokens that are absent from the text
	 */
	boolean isMissing();

	/**
	 * @return true for tokens that are allowed anywhere but do not belong to the grammar at this point
	 */
	boolean isExtra();

	boolean isError();

	default Optional<SyntaxNode> nextSibling() {
		SyntaxNode parent = getParent();
		if (parent == null) {
			return Optional.empty();
		}
		List<SyntaxNode> siblings = parent.getChildren();
		int index = siblings.indexOf(this);
		if (index < 0 || index + 1 >= siblings.size()) {
			return Optional.empty();
		}
		return Optional.of(siblings.get(index + 1));
	}
}
