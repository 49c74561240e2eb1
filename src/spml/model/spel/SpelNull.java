package spml.model.spel;

import java.util.Objects;

public class SpelNull extends SpelNode implements SpelObject, SpelExpression, SpelArgument {
	private final SpelLocation location;

	public SpelNull(SpelLocation location) {
		this.location = location;
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
		return "null";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelNull that = (SpelNull) o;
		return Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location);
	}
}
