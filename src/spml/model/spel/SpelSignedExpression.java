package spml.model.spel;

import java.util.Objects;

public class SpelSignedExpression extends SpelNode implements SpelExpression {
	private final SpelSign sign;
	private final SpelLocation signLocation;
	private final SpelExpression expression;

	public SpelSignedExpression(SpelSign sign, SpelLocation signLocation, SpelExpression expression) {
		this.sign = sign;
		this.signLocation = signLocation;
		this.expression = expression;
	}

	public SpelSign getSign() {
		return sign;
	}

	public SpelLocation getSignLocation() {
		return signLocation;
	}

	public SpelExpression getExpression() {
		return expression;
	}

	@Override
	public int getStartCharacter() {
		return signLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return expression.getEndCharacter();
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
		SpelSignedExpression that = (SpelSignedExpression) o;
		return Objects.equals(sign, that.sign) &&
				Objects.equals(signLocation, that.signLocation) &&
				Objects.equals(expression, that.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sign, signLocation, expression);
	}
}
