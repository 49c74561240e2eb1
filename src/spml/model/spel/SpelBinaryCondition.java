package spml.model.spel;

import java.util.Objects;

public class SpelBinaryCondition extends SpelNode implements SpelCondition {
	private final SpelCondition left;
	private final SpelConditionOperator operator;
	private final SpelCondition right;
	private final SpelLocation operatorLocation;

	public SpelBinaryCondition(SpelCondition left, SpelConditionOperator operator, SpelCondition right, SpelLocation operatorLocation) {
		this.left = left;
		this.operator = operator;
		this.right = right;
		this.operatorLocation = operatorLocation;
	}

	public SpelCondition getLeft() {
		return left;
	}

	public SpelConditionOperator getOperator() {
		return operator;
	}

	public SpelCondition getRight() {
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
		SpelBinaryCondition that = (SpelBinaryCondition) o;
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
