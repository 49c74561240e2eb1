package spml.model.spel;

import java.util.Objects;

/**
 * <code>!{name}</code>
 */
public class SpelAnchor extends SpelNode implements SpelObject, SpelArgument {
	private final SpelWord name;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelAnchor(SpelWord name, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.name = name;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public SpelWord getName() {
		return name;
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
		return "anchor";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelAnchor that = (SpelAnchor) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, openingBracketLocation, closingBracketLocation);
	}
}
