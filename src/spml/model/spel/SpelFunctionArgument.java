package spml.model.spel;

import java.util.Objects;
import java.util.Optional;

/**
 * An argument together with the comma that follows it, if any.
 */
public class SpelFunctionArgument extends SpelNode {
	private final SpelArgument argument;
	private final SpelLocation commaLocation;

	public SpelFunctionArgument(SpelArgument argument, SpelLocation commaLocation) {
		this.argument = argument;
		this.commaLocation = commaLocation;
	}

	public SpelArgument getArgument() {
		return argument;
	}

	public Optional<SpelLocation> getCommaLocation() {
		return Optional.ofNullable(commaLocation);
	}

	@Override
	public int getStartCharacter() {
		return argument.getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return commaLocation != null ? commaLocation.getEndCharacter() : argument.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "argument";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelFunctionArgument that = (SpelFunctionArgument) o;
		return Objects.equals(argument, that.argument) &&
				Objects.equals(commaLocation, that.commaLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(argument, commaLocation);
	}
}
