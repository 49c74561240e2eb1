package spml.model.spel;

import java.util.Objects;

/**
 * Compares two {@link SpelComparable}s, e.g. <code>${a} >= 4</code>.
 */
public class SpelComparison extends SpelNode implements SpelCondition {
	private final SpelComparable left;
	private final SpelComparisonOperator operator;
	private final SpelComparable right;
	private final SpelLocation operatorLocation;

	public SpelComparison(SpelComparable left, SpelComparisonOperator operator, SpelComparable right, SpelLocation operatorLocation) {
		this.left = left;
		this.operator = operator;
		this.right = right;
		this.operatorLocation = operatorLocation;
	}

	public SpelComparable getLeft() {
		return left;
	}

	public SpelComparisonOperator getOperator() {
		return operator;
	}

	public SpelComparable getRight() {
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
		SpelComparison that = (SpelComparison) o;
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
