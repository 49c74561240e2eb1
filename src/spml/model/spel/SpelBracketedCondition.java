package spml.model.spel;

import java.util.Objects;

public class SpelBracketedCondition extends SpelNode implements SpelCondition {
	private final SpelCondition condition;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelBracketedCondition(SpelCondition condition, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.condition = condition;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public SpelCondition getCondition() {
		return condition;
	}

	public SpelLocation getOpeningBracketLocation() {
		return openingBracketLocation;
	}

	public SpelLocation getClosingBracketLocation() {
		return closingBracketLocation;
	}

	@Override
	public int getStartCharacter() {
		return openingBracketLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return closingBracketLocation.getEndCharacter();
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
		SpelBracketedCondition that = (SpelBracketedCondition) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, openingBracketLocation, closingBracketLocation);
	}
}
