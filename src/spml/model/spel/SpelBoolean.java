package spml.model.spel;

import java.util.Objects;

public class SpelBoolean extends SpelNode implements SpelCondition, SpelArgument {
	private final boolean value;
	private final SpelLocation location;

	public SpelBoolean(boolean value, SpelLocation location) {
		this.value = value;
		this.location = location;
	}

	public boolean isValue() {
		return value;
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
		return "condition";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelBoolean that = (SpelBoolean) o;
		return value == that.value &&
				Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, location);
	}
}
