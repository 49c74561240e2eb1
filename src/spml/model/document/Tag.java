package spml.model.document;

import spml.model.schema.TagDefinition;
import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An SPML tag. All tag kinds share this shape; which attributes a tag may carry is decided by its
 * {@link TagDefinition}.
 */
public class Tag implements Ranged {
	private final TagDefinition definition;
	private final SingleLineSpan open;
	private final Map<String, Parsed<ExpressionAttribute>> attributes;
	private final TagBody body;
	private final SingleLineSpan close;

	public Tag(TagDefinition definition, SingleLineSpan open, Map<String, Parsed<ExpressionAttribute>> attributes,
	           TagBody body, SingleLineSpan close) {
		this.definition = definition;
		this.open = open;
		this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
		this.body = body;
		this.close = close;
	}

	public TagDefinition getDefinition() {
		return definition;
	}

	public String getName() {
		return definition.getName();
	}

	/**
	 * @return the span of "&lt;sp:name"
	 */
	public SingleLineSpan getOpen() {
		return open;
	}

	/**
	 * @return the attributes in source order, keyed by name
	 */
	public Map<String, Parsed<ExpressionAttribute>> getAttributes() {
		return attributes;
	}

	public Optional<Parsed<ExpressionAttribute>> getAttribute(String name) {
		return Optional.ofNullable(attributes.get(name));
	}

	public Optional<TagBody> getBody() {
		return Optional.ofNullable(body);
	}

	/**
	 * @return the span of "/&gt;" or of the closing tag
	 */
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
		Tag tag = (Tag) o;
		return definition.equals(tag.definition) && open.equals(tag.open) && attributes.equals(tag.attributes)
				&& Objects.equals(body, tag.body) && close.equals(tag.close);
	}

	@Override
	public int hashCode() {
		return Objects.hash(definition, open, attributes, body, close);
	}

	@Override
	public String toString() {
		return "<" + definition.getName() + " " + attributes.keySet() + ">";
	}
}
