package spml.model.spel;

import java.util.Objects;

/**
 * <code>left operator right</code>
 */
public class SpelBinaryExpression extends SpelNode implements SpelExpression {
	private final SpelExpression left;
	private final SpelExpressionOperator operator;
	private final SpelExpression right;
	private final SpelLocation operatorLocation;

	public SpelBinaryExpression(SpelExpression left, SpelExpressionOperator operator, SpelExpression right, SpelLocation operatorLocation) {
		this.left = left;
		this.operator = operator;
		this.right = right;
		this.operatorLocation = operatorLocation;
	}

	public SpelExpression getLeft() {
		return left;
	}

	public SpelExpressionOperator getOperator() {
		return operator;
	}

	public SpelExpression getRight() {
		return right;
	}

	public SpelLocation getOperatorLocation() {
		return operatorLocation;
	}

	@Override
	public int getStartCharacter() {
		return left.getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return right.getEndCharacter();
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
		SpelBinaryExpression that = (SpelBinaryExpression) o;
		return Objects.equals(left, that.left) &&
				Objects.equals(operator, that.operator) &&
				Objects.equals(right, that.right) &&
				Objects.equals(operatorLocation, that.operatorLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(left, operator, right, operatorLocation);
	}
}
