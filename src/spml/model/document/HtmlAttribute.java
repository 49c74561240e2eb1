package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * An attribute of an html element. Html attributes may omit their value, and the value may embed SPML tags.
 */
public class HtmlAttribute implements Ranged {
	private final AttributeKey key;
	private final Value value;

	public HtmlAttribute(AttributeKey key, Value value) {
		this.key = key;
		this.value = value;
	}

	public AttributeKey getKey() {
		return key;
	}

	public Optional<Value> getValue() {
		return Optional.ofNullable(value);
	}

	@Override
	public Position start() {
		return key.start();
	}

	@Override
	public Position end() {
		return value == null ? key.end() : value.getClosingQuote().end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		HtmlAttribute that = (HtmlAttribute) o;
		return key.equals(that.key) && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	@Override
	public String toString() {
		return value == null ? key.toString() : key + "=" + value.getContent();
	}

	public static class Value {
		private final SingleLineSpan equals;
		private final SingleLineSpan openingQuote;
		private final HtmlAttributeValueContent content;
		private final SingleLineSpan closingQuote;

		public Value(SingleLineSpan equals, SingleLineSpan openingQuote, HtmlAttributeValueContent content,
		             SingleLineSpan closingQuote) {
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

		public HtmlAttributeValueContent getContent() {
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
