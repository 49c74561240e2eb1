package spml.model.document;

import spml.util.Position;
import spml.util.Range;

import java.util.Objects;
import java.util.Optional;

/**
 * Text the syntax tree could not assign to any construct.
 */
public class ErrorNode extends Node {
	private final String content;
	private final Range range;

	public ErrorNode(String content, Range range) {
		this.content = content;
		this.range = range;
	}

	public String getContent() {
		return content;
	}

	@Override
	public Optional<TagBody> getBody() {
		return Optional.empty();
	}

	@Override
	public Position start() {
		return range.getStart();
	}

	@Override
	public Position end() {
		return range.getEnd();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ErrorNode that = (ErrorNode) o;
		return content.equals(that.content) && range.equals(that.range);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, range);
	}

	@Override
	public String toString() {
		return "ErrorNode(\"" + content + "\")";
	}
}
