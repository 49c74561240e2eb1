package spml.cst;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

import spml.cst.NodeMovingResult.Outcome;
import spml.util.Position;
import spml.util.SingleLineSpan;

public class TreeWalkerTest {

	private static final String TEXT = "<a b c>";

	private TreeWalker walker() {
		SyntaxNodeBuilder b = new SyntaxNodeBuilder(TEXT);
		SyntaxNode root = b.node("document", 0, 7,
				b.node("tag", 0, 7,
						b.token("open", "<a"),
						b.extra("attribute", 3, 4),
						b.error(5, 6),
						b.missing("close", 7)));
		return new TreeWalker(b.tree(root));
	}

	@Test
	public void movementsClassifyTheNodeArrivedAt() {
		TreeWalker walker = walker();
		assertThat(walker.move(NodeMovement.FIRST_CHILD).getOutcome(), is(Outcome.OK));
		NodeMovingResult open = walker.move(NodeMovement.FIRST_CHILD);
		assertTrue(open.is(Outcome.OK, "open"));
		assertThat(walker.move(NodeMovement.NEXT_SIBLING).getOutcome(), is(Outcome.SUPERFLUOUS));
		assertThat(walker.move(NodeMovement.NEXT_SIBLING).getOutcome(), is(Outcome.ERRONEOUS));
		assertThat(walker.move(NodeMovement.NEXT_SIBLING).getOutcome(), is(Outcome.MISSING));
		assertThat(walker.move(NodeMovement.CURRENT).getOutcome(), is(Outcome.MISSING));
		assertThat(walker.move(NodeMovement.NEXT_SIBLING).getOutcome(), is(Outcome.NON_EXISTENT));
		// a failed movement leaves the cursor where it was
		assertThat(walker.node().getKind(), is("close"));
	}

	@Test
	public void leavesHaveNoFirstChild() {
		TreeWalker walker = walker();
		walker.gotoFirstChild();
		walker.gotoFirstChild();
		assertThat(walker.move(NodeMovement.FIRST_CHILD), is(NodeMovingResult.nonExistent()));
	}

	@Test(expected = IllegalStateException.class)
	public void nonExistentResultHasNoNode() {
		NodeMovingResult.nonExistent().getNode();
	}

	@Test
	public void missingTakesPriorityOverErrorAndExtra() {
		TreeNode node = new TreeNode("x", 0, new Position(0, 0));
		node.markExtra().markError().markMissing();
		assertThat(NodeMovingResult.classify(node).getOutcome(), is(Outcome.MISSING));
		TreeNode erroneous = new TreeNode("y", 0, new Position(0, 0));
		erroneous.markExtra().markError();
		assertThat(NodeMovingResult.classify(erroneous).getOutcome(), is(Outcome.ERRONEOUS));
	}

	@Test
	public void markRestoresDepthButKeepsSiblingMoves() {
		TreeWalker walker = walker();
		walker.gotoFirstChild();
		walker.gotoFirstChild();
		try (TreeCursor.Mark mark = walker.mark()) {
			assertThat(mark.getDepth(), is(2));
			walker.gotoNextSibling();
			assertFalse(walker.gotoFirstChild());
		}
		assertThat(walker.depth(), is(2));
		assertThat(walker.node().getKind(), is("attribute"));

		walker.gotoParent();
		try (TreeCursor.Mark ignored = walker.mark()) {
			walker.gotoFirstChild();
			walker.gotoNextSibling();
			walker.gotoNextSibling();
		}
		assertThat(walker.depth(), is(1));
		assertThat(walker.node().getKind(), is("tag"));
	}

	@Test
	public void rootHasNoSiblingsOrParent() {
		TreeWalker walker = walker();
		assertFalse(walker.gotoNextSibling());
		assertFalse(walker.gotoParent());
		assertThat(walker.depth(), is(0));
	}

	@Test
	public void spanAndText() {
		TreeWalker walker = walker();
		walker.gotoFirstChild();
		walker.gotoFirstChild();
		assertThat(TreeWalker.span(walker.node()), is(new SingleLineSpan(0, 0, 2)));
		assertThat(walker.text(walker.node()), is("<a"));
	}
}
