package spml.model.spel;

import java.util.Objects;

public class SpelBracketedExpression extends SpelNode implements SpelExpression {
	private final SpelExpression expression;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelBracketedExpression(SpelExpression expression, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.expression = expression;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public SpelExpression getExpression() {
		return expression;
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
		return "expression";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelBracketedExpression that = (SpelBracketedExpression) o;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, openingBracketLocation, closingBracketLocation);
	}
}
