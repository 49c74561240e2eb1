package spml.model.spel;

import java.util.List;
import java.util.Objects;

/**
 * A global function call or, as part of a {@link SpelMethodAccess}, a method call.
 */
public class SpelFunction extends SpelNode implements SpelObject, SpelExpression, SpelCondition, SpelArgument {
	private final String name;
	private final SpelLocation nameLocation;
	private final List<SpelFunctionArgument> arguments;
	private final SpelLocation openingBracketLocation;
	private final SpelLocation closingBracketLocation;

	public SpelFunction(String name, SpelLocation nameLocation, List<SpelFunctionArgument> arguments, SpelLocation openingBracketLocation, SpelLocation closingBracketLocation) {
		this.name = name;
		this.nameLocation = nameLocation;
		this.arguments = arguments;
		this.openingBracketLocation = openingBracketLocation;
		this.closingBracketLocation = closingBracketLocation;
	}

	public String getName() {
		return name;
	}

	public SpelLocation getNameLocation() {
		return nameLocation;
	}

	public List<SpelFunctionArgument> getArguments() {
		return arguments;
	}

	public SpelLocation getOpeningBracketLocation() {
		return openingBracketLocation;
	}

	public SpelLocation getClosingBracketLocation() {
		return closingBracketLocation;
	}

	@Override
	public int getStartCharacter() {
		return nameLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return closingBracketLocation.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "function";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelFunction that = (SpelFunction) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(nameLocation, that.nameLocation) &&
				Objects.equals(arguments, that.arguments) &&
				Objects.equals(openingBracketLocation, that.openingBracketLocation) &&
				Objects.equals(closingBracketLocation, that.closingBracketLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, nameLocation, arguments, openingBracketLocation, closingBracketLocation);
	}
}
