package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Objects;

public class AttributeKey implements Ranged {
	private final String value;
	private final SingleLineSpan span;

	public AttributeKey(String value, SingleLineSpan span) {
		this.value = value;
		this.span = span;
	}

	public String getValue() {
		return value;
	}

	public SingleLineSpan getSpan() {
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

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		AttributeKey that = (AttributeKey) o;
		return value.equals(that.value) && span.equals(that.span);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, span);
	}

	@Override
	public String toString() {
		return value;
	}
}
