package spml.model.spel;

import java.util.Objects;

/**
 * Where a token of a SPEL text is, as a character offset into the text. Single and double character tokens
 * (brackets, operators) are told apart from tokens of variable length (names, literals). {@link SpelSource} maps
 * locations to document positions.
 */
public abstract class SpelLocation {
	private final int character;

	SpelLocation(int character) {
		this.character = character;
	}

	public int getCharacter() {
		return character;
	}

	public abstract int getLength();

	public int getEndCharacter() {
		return character + getLength();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelLocation that = (SpelLocation) o;
		return character == that.character && getLength() == that.getLength();
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), character, getLength());
	}

	@Override
	public String toString() {
		return "(" + character + ", " + getLength() + ")";
	}

	public static SingleCharacter single(int character) {
		return new SingleCharacter(character);
	}

	public static DoubleCharacter pair(int character) {
		return new DoubleCharacter(character);
	}

	public static VariableLength variable(int character, int length) {
		return new VariableLength(character, length);
	}

	public static class SingleCharacter extends SpelLocation {
		public SingleCharacter(int character) {
			super(character);
		}

		@Override
		public int getLength() {
			return 1;
		}
	}

	public static class DoubleCharacter extends SpelLocation {
		public DoubleCharacter(int character) {
			super(character);
		}

		@Override
		public int getLength() {
			return 2;
		}
	}

	public static class VariableLength extends SpelLocation {
		private final int length;

		public VariableLength(int character, int length) {
			super(character);
			this.length = length;
		}

		@Override
		public int getLength() {
			return length;
		}
	}
}
