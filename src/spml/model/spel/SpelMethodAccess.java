package spml.model.spel;

import java.util.Objects;

public class SpelMethodAccess extends SpelNode implements SpelObject {
	private final SpelObject object;
	private final SpelFunction function;
	private final SpelLocation dotLocation;

	public SpelMethodAccess(SpelObject object, SpelFunction function, SpelLocation dotLocation) {
		this.object = object;
		this.function = function;
		this.dotLocation = dotLocation;
	}

	public SpelObject getObject() {
		return object;
	}

	public SpelFunction getFunction() {
		return function;
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
		return function.getEndCharacter();
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
		SpelMethodAccess that = (SpelMethodAccess) o;
		return Objects.equals(object, that.object) &&
				Objects.equals(function, that.function) &&
				Objects.equals(dotLocation, that.dotLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(object, function, dotLocation);
	}
}
