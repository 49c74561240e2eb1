package spml.errors;

import spml.util.Span;

import java.util.Optional;

/**
 * A construct that the parser had to give up on.
 */
@SuppressWarnings("serial")
public class UnparsableIssue extends Issue {
	private final String reason;
	private final Span span;

	public UnparsableIssue(String reason, Span span) {
		this.reason = reason;
		this.span = span;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public Optional<Span> getSpan() {
		return Optional.of(span);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
