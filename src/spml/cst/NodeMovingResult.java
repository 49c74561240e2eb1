package spml.cst;

import java.util.Objects;

/**
 * The classification of the node a cursor arrived at, see {@link TreeWalker#move(NodeMovement)}.
 */
public final class NodeMovingResult {
	public enum Outcome {
		NON_EXISTENT,
		MISSING,
		ERRONEOUS,
		SUPERFLUOUS,
		OK,
	}

	private static final NodeMovingResult NON_EXISTENT = new NodeMovingResult(Outcome.NON_EXISTENT, null);

	private final Outcome outcome;
	private final SyntaxNode node;

	private NodeMovingResult(Outcome outcome, SyntaxNode node) {
		this.outcome = outcome;
		this.node = node;
	}

	public static NodeMovingResult nonExistent() {
		return NON_EXISTENT;
	}

	public static NodeMovingResult classify(SyntaxNode node) {
		if (node.isMissing()) {
			return new NodeMovingResult(Outcome.MISSING, node);
		}
		if (node.isError()) {
			return new NodeMovingResult(Outcome.ERRONEOUS, node);
		}
		if (node.isExtra()) {
			return new NodeMovingResult(Outcome.SUPERFLUOUS, node);
		}
		return new NodeMovingResult(Outcome.OK, node);
	}

	public Outcome getOutcome() {
		return outcome;
	}

	/**
	 * @return the node the cursor arrived at
	 * @throws IllegalStateException if the movement was not possible
	 */
	public SyntaxNode getNode() {
		if (node == null) {
			throw new IllegalStateException("there is no node after a failed movement");
		}
		return node;
	}

	public boolean is(Outcome outcome, String kind) {
		return this.outcome == outcome && node.getKind().equals(kind);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NodeMovingResult that = (NodeMovingResult) o;
		return outcome == that.outcome && node == that.node;
	}

	@Override
	public int hashCode() {
		return Objects.hash(outcome, node);
	}

	@Override
	public String toString() {
		return node == null ? outcome.toString() : outcome + "(" + node + ")";
	}
}
