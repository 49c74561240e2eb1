package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Objects;

/**
 * An attribute whose value is kept as raw text, as in page and taglib headers.
 */
public class PlainAttribute implements Ranged {
	private final AttributeKey key;
	private final Value value;

	public PlainAttribute(AttributeKey key, Value value) {
		this.key = key;
		this.value = value;
	}

	public AttributeKey getKey() {
		return key;
	}

	public Value getValue() {
		return value;
	}

	@Override
	public Position start() {
		return key.start();
	}

	@Override
	public Position end() {
		return value.getClosingQuote().end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PlainAttribute that = (PlainAttribute) o;
		return key.equals(that.key) && value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	@Override
	public String toString() {
		return key + "=\"" + value.getContent() + "\"";
	}

	public static class Value {
		private final SingleLineSpan equals;
		private final SingleLineSpan openingQuote;
		private final String content;
		private final SingleLineSpan closingQuote;

		public Value(SingleLineSpan equals, SingleLineSpan openingQuote, String content, SingleLineSpan closingQuote) {
			this.equals = equals;
			this.openingQuote = openingQuote;
			this.content = content;
			this.closingQuote = closingQuote;
		}

		public SingleLineSpan getEquals() {
			return equals;
		}

		public SingleLineSpan getOpeningQuote() {
			return openingQuote;
		}

		public String getContent() {
			return content;
		}

		public SingleLineSpan getClosingQuote() {
			return closingQuote;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Value value = (Value) o;
			return equals.equals(value.equals) && openingQuote.equals(value.openingQuote)
					&& content.equals(value.content) && closingQuote.equals(value.closingQuote);
		}

		@Override
		public int hashCode() {
			return Objects.hash(equals, openingQuote, content, closingQuote);
		}
	}
}
