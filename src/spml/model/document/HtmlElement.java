package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class HtmlElement implements Ranged {
	private final String name;
	private final SingleLineSpan open;
	private final List<Parsed<HtmlAttribute>> attributes;
	private final TagBody body;
	private final SingleLineSpan close;

	public HtmlElement(String name, SingleLineSpan open, List<Parsed<HtmlAttribute>> attributes, TagBody body,
	                   SingleLineSpan close) {
		this.name = name;
		this.open = open;
		this.attributes = Collections.unmodifiableList(attributes);
		this.body = body;
		this.close = close;
	}

	public String getName() {
		return name;
	}

	public SingleLineSpan getOpen() {
		return open;
	}

	public List<Parsed<HtmlAttribute>> getAttributes() {
		return attributes;
	}

	public Optional<TagBody> getBody() {
		return Optional.ofNullable(body);
	}

	public SingleLineSpan getClose() {
		return close;
	}

	@Override
	public Position start() {
		return open.start();
	}

	@Override
	public Position end() {
		return close.end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		HtmlElement that = (HtmlElement) o;
		return name.equals(that.name) && open.equals(that.open) && attributes.equals(that.attributes)
				&& Objects.equals(body, that.body) && close.equals(that.close);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, open, attributes, body, close);
	}

	@Override
	public String toString() {
		return "<" + name + ">";
	}
}
