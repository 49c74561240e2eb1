package spml.errors;

import spml.model.document.ErrorNode;
import spml.util.Span;

import java.util.Optional;

@SuppressWarnings("serial")
public class ErrorNodeIssue extends Issue {
	private final ErrorNode node;

	public ErrorNodeIssue(ErrorNode node) {
		this.node = node;
	}

	public ErrorNode getNode() {
		return node;
	}

	@Override
	public Optional<Span> getSpan() {
		return Optional.of(Span.between(node.start(), node.end()));
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
