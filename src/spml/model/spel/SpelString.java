package spml.model.spel;

import java.util.Objects;

/**
 * A single quoted string literal. The content excludes the quotes, escape sequences are kept verbatim.
 */
public class SpelString extends SpelNode implements SpelObject, SpelArgument {
	private final String content;
	private final SpelLocation location;

	public SpelString(String content, SpelLocation location) {
		this.content = content;
		this.location = location;
	}

	public String getContent() {
		return content;
	}

	public SpelLocation getLocation() {
		return location;
	}

	@Override
	public int getStartCharacter() {
		return location.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return location.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "string";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelString that = (SpelString) o;
		return Objects.equals(content, that.content) &&
				Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, location);
	}
}
