package spml.model.spel;

import java.util.Objects;

public class SpelArrayAccess extends SpelNode implements SpelObject {
	private final SpelObject object;
	private final SpelExpression index;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelArrayAccess(SpelObject object, SpelExpression index, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.object = object;
		this.index = index;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public SpelObject getObject() {
		return object;
	}

	public SpelExpression getIndex() {
		return index;
	}

	public SpelLocation getOpeningBracketLocation() {
		return openingBracketLocation;
	}

	public SpelLocation getClosingBracketLocation() {
		return closingBracketLocation;
	}

	@Override
	public int getStartCharacter() {
		return object.getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return closingBracketLocation.getEndCharacter();
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
		SpelArrayAccess that = (SpelArrayAccess) o;
		return Objects.equals(object, that.object) &&
				Objects.equals(index, that.index) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(object, index, openingBracketLocation, closingBracketLocation);
	}
}
