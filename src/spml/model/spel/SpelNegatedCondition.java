package spml.model.spel;

import java.util.Objects;

public class SpelNegatedCondition extends SpelNode implements SpelCondition {
	private final SpelCondition condition;
	private final SpelLocation exclamationMarkLocation;

	public SpelNegatedCondition(SpelCondition condition, SpelLocation exclamationMarkLocation) {
		this.condition = condition;
		this.exclamationMarkLocation = exclamationMarkLocation;
	}

	public SpelCondition getCondition() {
		return condition;
	}

	public SpelLocation getExclamationMarkLocation() {
		return exclamationMarkLocation;
	}

	@Override
	public int getStartCharacter() {
		return exclamationMarkLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return condition.getEndCharacter();
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
		SpelNegatedCondition that = (SpelNegatedCondition) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(exclamationMarkLocation, that.exclamationMarkLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, exclamationMarkLocation);
	}
}
