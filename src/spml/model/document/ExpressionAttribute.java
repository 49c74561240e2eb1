package spml.model.document;

import spml.model.spel.SpelAst;
import spml.model.spel.SpelSource;
import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Objects;

/**
 * An attribute of an SPML tag. Its value is parsed with the SPEL grammar the tag schema declares for it.
 */
public class ExpressionAttribute implements Ranged {
	private final AttributeKey key;
	private final Value value;

	public ExpressionAttribute(AttributeKey key, Value value) {
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
		ExpressionAttribute that = (ExpressionAttribute) o;
		return key.equals(that.key) && value.equals(that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}

	@Override
	public String toString() {
		return key + "=" + value.getSpel();
	}

	public static class Value {
		private final SingleLineSpan equals;
		private final SingleLineSpan openingQuote;
		private final SpelAst spel;
		private final SingleLineSpan closingQuote;
		private final SpelSource source;

		/**
		 * @param text the value between the quotes, exactly as it appears in the document
		 */
		public Value(SingleLineSpan equals, SingleLineSpan openingQuote, SpelAst spel, String text,
				SingleLineSpan closingQuote) {
			this.equals = equals;
			this.openingQuote = openingQuote;
			this.spel = spel;
			this.closingQuote = closingQuote;
			this.source = new SpelSource(openingQuote.end(), text);
		}

		public SingleLineSpan getEquals() {
			return equals;
		}

		public SingleLineSpan getOpeningQuote() {
			return openingQuote;
		}

		public SpelAst getSpel() {
			return spel;
		}

		public SingleLineSpan getClosingQuote() {
			return closingQuote;
		}

		/**
		 * @return the mapping of locations inside {@link #getSpel()} to document positions
		 */
		public SpelSource getSpelSource() {
			return source;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Value value = (Value) o;
			return equals.equals(value.equals) && openingQuote.equals(value.openingQuote)
					&& spel.equals(value.spel) && closingQuote.equals(value.closingQuote) && source.equals(value.source);
		}

		@Override
		public int hashCode() {
			return Objects.hash(equals, openingQuote, spel, closingQuote, source);
		}
	}
}
