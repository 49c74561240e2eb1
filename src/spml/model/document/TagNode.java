package spml.model.document;

import spml.util.Position;

import java.util.Objects;
import java.util.Optional;

public class TagNode extends Node {
	private final Parsed<Tag> tag;

	public TagNode(Parsed<Tag> tag) {
		this.tag = tag;
	}

	public Parsed<Tag> getTag() {
		return tag;
	}

	@Override
	public Optional<TagBody> getBody() {
		return tag.getValue().flatMap(Tag::getBody);
	}

	@Override
	public Position start() {
		return tag.start();
	}

	@Override
	public Position end() {
		return tag.end();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return tag.equals(((TagNode) o).tag);
	}

	@Override
	public int hashCode() {
		return Objects.hash(tag);
	}

	@Override
	public String toString() {
		return tag.toString();
	}
}
