package spml.util;

import java.util.Objects;

public class SingleLineSpan extends Span {
	private final int line;
	private final int character;
	private final int length;

	public SingleLineSpan(int line, int character, int length) {
		if (length < 0) {
			throw new IllegalArgumentException("span length must not be negative: " + length);
		}
		this.line = line;
		this.character = character;
		this.length = length;
	}

	public int getLine() {
		return line;
	}

	public int getCharacter() {
		return character;
	}

	public int getLength() {
		return length;
	}

	@Override
	public Position start() {
		return new Position(line, character);
	}

	@Override
	public Position end() {
		return new Position(line, character + length);
	}

	@Override
	public boolean contains(Position position) {
		return position.getLine() == line
				&& position.getCharacter() >= character
				&& position.getCharacter() <= character + length;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SingleLineSpan that = (SingleLineSpan) o;
		return line == that.line && character == that.character && length == that.length;
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, character, length);
	}
}
