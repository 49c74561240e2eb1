package spml.model.spel;

import java.util.Objects;

public class SpelFieldAccess extends SpelNode implements SpelObject {
	private final SpelObject object;
	private final SpelWord field;
	private final SpelLocation dotLocation;

	public SpelFieldAccess(SpelObject object, SpelWord field, SpelLocation dotLocation) {
		this.object = object;
		this.field = field;
		this.dotLocation = dotLocation;
	}

	public SpelObject getObject() {
		return object;
	}

	public SpelWord getField() {
		return field;
	}

	public SpelLocation getDotLocation() {
		return dotLocation;
	}

	@Override
	public int getStartCharacter() {
		return object.getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return field.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "object";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelFieldAccess that = (SpelFieldAccess) o;
		return Objects.equals(object, that.object) &&
				Objects.equals(field, that.field) &&
				Objects.equals(dotLocation, that.dotLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(object, field, dotLocation);
	}
}
