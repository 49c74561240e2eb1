package spml.model.document;

import spml.util.Position;

import java.util.Objects;
import java.util.Optional;

public class HtmlNode extends Node {
	private final Parsed<HtmlElement> element;

	public HtmlNode(Parsed<HtmlElement> element) {
		this.element = element;
	}

	public Parsed<HtmlElement> getElement() {
		return element;
	}

	@Override
	public Optional<TagBody> getBody() {
		return element.getValue().flatMap(HtmlElement::getBody);
	}

	@Override
	public Position start() {
		return element.start();
	}

	@Override
	public Position end() {
		return element.end();
	}

	@Override
	public <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return element.equals(((HtmlNode) o).element);
	}

	@Override
	public int hashCode() {
		return Objects.hash(element);
	}

	@Override
	public String toString() {
		return element.toString();
	}
}
