package spml.util;

import java.util.Objects;

/**
 * A zero-based line and character offset into a document. Characters are counted in UTF-16 code units.
 */
public class Position implements Comparable<Position> {
	private final int line;
	private final int character;

	public Position(int line, int character) {
		this.line = line;
		this.character = character;
	}

	public int getLine() {
		return line;
	}

	public int getCharacter() {
		return character;
	}

	public Position withCharacter(int character) {
		return new Position(line, character);
	}

	public Position offsetBy(int lines, int characters) {
		return new Position(line + lines, character + characters);
	}

	public boolean isBefore(Position other) {
		return compareTo(other) < 0;
	}

	public boolean isAfter(Position other) {
		return compareTo(other) > 0;
	}

	@Override
	public int compareTo(Position other) {
		if (line != other.line) {
			return Integer.compare(line, other.line);
		}
		return Integer.compare(character, other.character);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Position position = (Position) o;
		return line == position.line && character == position.character;
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, character);
	}

	@Override
	public String toString() {
		return (line + 1) + ":" + (character + 1);
	}
}
