package spml.errors;

import spml.util.Span;

import java.util.Optional;

/**
 * A token that is superfluous or missing, tolerated by the parser.
 */
@SuppressWarnings("serial")
public class StructuralIssue extends Issue {
	private final ParseIssue parseIssue;

	public StructuralIssue(ParseIssue parseIssue) {
		this.parseIssue = parseIssue;
	}

	public ParseIssue getParseIssue() {
		return parseIssue;
	}

	@Override
	public Optional<Span> getSpan() {
		return Optional.of(parseIssue.getSpan());
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
