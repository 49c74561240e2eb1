package spml.errors;

import spml.model.spel.SpelSyntaxError;
import spml.util.Span;

import java.util.Optional;

/**
 * An attribute value that is not valid in the expression-language grammar of its attribute.
 */
@SuppressWarnings("serial")
public class SpelSyntaxIssue extends Issue {
	private final String attribute;
	private final SpelSyntaxError error;
	private final Span span;

	/**
	 * @param span the absolute document region of the error
	 */
	public SpelSyntaxIssue(String attribute, SpelSyntaxError error, Span span) {
		this.attribute = attribute;
		this.error = error;
		this.span = span;
	}

	public String getAttribute() {
		return attribute;
	}

	public SpelSyntaxError getError() {
		return error;
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
