package spml.errors;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.Span;

import java.util.Objects;

/**
 * A recoverable deviation from the SPML grammar, recorded on the nearest enclosing tag, attribute, html element or
 * header instead of aborting it.
 */
public abstract class ParseIssue implements Ranged {
	private final String text;
	private final Span span;

	ParseIssue(String text, Span span) {
		this.text = text;
		this.span = span;
	}

	/**
	 * @return the offending text for superfluous tokens, or the text that should be inserted for missing ones
	 */
	public String getText() {
		return text;
	}

	public Span getSpan() {
		return span;
	}

	@Override
	public Position start() {
		return span.start();
	}

	@Override
	public Position end() {
		return span.end();
	}

	public abstract <T, E extends Throwable> T accept(ParseIssueVisitor<T, E> v) throws E;

	public static Superfluous superfluous(String text, Span span) {
		return new Superfluous(text, span);
	}

	public static Missing missing(String text, Span span) {
		return new Missing(text, span);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParseIssue that = (ParseIssue) o;
		return text.equals(that.text) && span.equals(that.span);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), text, span);
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "(\"" + text + "\", " + span + ")";
	}

	/**
	 * A token that should not be there. Deleting it fixes the issue.
	 */
	public static class Superfluous extends ParseIssue {
		public Superfluous(String text, Span span) {
			super(text, span);
		}

		@Override
		public <T, E extends Throwable> T accept(ParseIssueVisitor<T, E> v) throws E {
			return v.visit(this);
		}
	}

	/**
	 * A required token that is absent. The span marks where it should be inserted.
	 */
	public static class Missing extends ParseIssue {
		public Missing(String text, Span span) {
			super(text, span);
		}

		@Override
		public <T, E extends Throwable> T accept(ParseIssueVisitor<T, E> v) throws E {
			return v.visit(this);
		}
	}
}
