package spml.util;

import java.util.Objects;

public class MultiLineSpan extends Span {
	private final int startLine;
	private final int startCharacter;
	private final int endLine;
	private final int endCharacter;

	public MultiLineSpan(int startLine, int startCharacter, int endLine, int endCharacter) {
		if (endLine < startLine) {
			throw new IllegalArgumentException("span ends on line " + endLine + " before it starts on " + startLine);
		}
		this.startLine = startLine;
		this.startCharacter = startCharacter;
		this.endLine = endLine;
		this.endCharacter = endCharacter;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartCharacter() {
		return startCharacter;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndCharacter() {
		return endCharacter;
	}

	@Override
	public Position start() {
		return new Position(startLine, startCharacter);
	}

	@Override
	public Position end() {
		return new Position(endLine, endCharacter);
	}

	@Override
	public boolean contains(Position position) {
		int line = position.getLine();
		if (line < startLine || line > endLine) {
			return false;
		}
		if (line == startLine && position.getCharacter() < startCharacter) {
			return false;
		}
		return line != endLine || position.getCharacter() <= endCharacter;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		MultiLineSpan that = (MultiLineSpan) o;
		return startLine == that.startLine && startCharacter == that.startCharacter
				&& endLine == that.endLine && endCharacter == that.endCharacter;
	}

	@Override
	public int hashCode() {
		return Objects.hash(startLine, startCharacter, endLine, endCharacter);
	}
}
