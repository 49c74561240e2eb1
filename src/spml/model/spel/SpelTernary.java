package spml.model.spel;

import java.util.Objects;

/**
 * <code>condition ? left : right</code>
 */
public class SpelTernary extends SpelNode implements SpelExpression {
	private final SpelCondition condition;
	private final SpelExpression left;
	private final SpelExpression right;
	private final SpelLocation questionMarkLocation;
	private final SpelLocation colonLocation;

	public SpelTernary(SpelCondition condition, SpelExpression left, SpelExpression right, SpelLocation questionMarkLocation, SpelLocation colonLocation) {
		this.condition = condition;
		this.left = left;
		this.right = right;
		this.questionMarkLocation = questionMarkLocation;
		this.colonLocation = colonLocation;
	}

	public SpelCondition getCondition() {
		return condition;
	}

	public SpelExpression getLeft() {
		return left;
	}

	public SpelExpression getRight() {
		return right;
	}

	public SpelLocation getQuestionMarkLocation() {
		return questionMarkLocation;
	}

	public SpelLocation getColonLocation() {
		return colonLocation;
	}

	@Override
	public int getStartCharacter() {
		return condition.getStartCharacter();
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
		SpelTernary that = (SpelTernary) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(left, that.left) &&
				Objects.equals(right, that.right) &&
				Objects.equals(questionMarkLocation, that.questionMarkLocation) &&
				Objects.equals(colonLocation, that.colonLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, left, right, questionMarkLocation, colonLocation);
	}
}
