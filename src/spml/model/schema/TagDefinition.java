package spml.model.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public class TagDefinition {
	private final String name;
	private final boolean deprecated;
	private final TagChildren children;
	private final Map<String, TagAttributeDefinition> attributes;
	private final List<AttributeRule> rules;

	public TagDefinition(String name, boolean deprecated, TagChildren children,
	                     List<TagAttributeDefinition> attributes, List<AttributeRule> rules) {
		this.name = name;
		this.deprecated = deprecated;
		this.children = children;
		this.attributes = new LinkedHashMap<>();
		for (TagAttributeDefinition attribute : attributes) {
			this.attributes.put(attribute.getName(), attribute);
		}
		this.rules = Collections.unmodifiableList(rules);
	}

	/**
	 * @return the qualified name as written in documents, e.g. "sp:barcode"
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the syntax tree node kind of this tag, e.g. "barcode_tag" or "spt_counter_tag"
	 */
	public String getKind() {
		return kindOf(name);
	}

	public boolean isDeprecated() {
		return deprecated;
	}

	public TagChildren getChildren() {
		return children;
	}

	public Collection<TagAttributeDefinition> getAttributes() {
		return Collections.unmodifiableCollection(attributes.values());
	}

	public Optional<TagAttributeDefinition> getAttribute(String name) {
		return Optional.ofNullable(attributes.get(name));
	}

	public List<AttributeRule> getRules() {
		return rules;
	}

	public static String kindOf(String name) {
		int colon = name.indexOf(':');
		String prefix = name.substring(0, colon);
		String local = name.substring(colon + 1).toLowerCase(Locale.ROOT);
		return "sp".equals(prefix) ? local + "_tag" : prefix + "_" + local + "_tag";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return name.equals(((TagDefinition) o).name);
	}

	@Override
	public int hashCode() {
		return name.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
