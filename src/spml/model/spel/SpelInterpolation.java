package spml.model.spel;

import java.util.Objects;

/**
 * <code>${object}</code>
 */
public class SpelInterpolation extends SpelNode implements SpelWordFragment, SpelExpression, SpelCondition, SpelArgument, SpelUri {
	private final SpelObject content;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelInterpolation(SpelObject content, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.content = content;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public SpelObject getContent() {
		return content;
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
		SpelInterpolation that = (SpelInterpolation) o;
		return Objects.equals(content, that.content) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(content, openingBracketLocation, closingBracketLocation);
	}
}
