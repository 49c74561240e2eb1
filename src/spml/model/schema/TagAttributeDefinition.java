package spml.model.schema;

import java.util.Objects;
import java.util.Optional;

public class TagAttributeDefinition {
	private final String name;
	private final TagAttributeType type;
	private final String moduleAttribute;

	public TagAttributeDefinition(String name, TagAttributeType type, String moduleAttribute) {
		this.name = name;
		this.type = type;
		this.moduleAttribute = moduleAttribute;
	}

	public TagAttributeDefinition(String name, TagAttributeType type) {
		this(name, type, null);
	}

	public String getName() {
		return name;
	}

	public TagAttributeType getType() {
		return type;
	}

	/**
	 * @return for {@link TagAttributeType#URI} attributes, the attribute naming the module the uri is resolved in
	 */
	public Optional<String> getModuleAttribute() {
		return Optional.ofNullable(moduleAttribute);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TagAttributeDefinition that = (TagAttributeDefinition) o;
		return name.equals(that.name) && type == that.type && Objects.equals(moduleAttribute, that.moduleAttribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type, moduleAttribute);
	}

	@Override
	public String toString() {
		return name + ": " + type;
	}
}
