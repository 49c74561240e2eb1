package spml.util;

/**
 * A line and column addressed region of source text. Nothing in the parsed document model stores raw offsets,
 * every location is one of these.
 */
public abstract class Span implements Ranged {

	public abstract boolean contains(Position position);

	/**
	 * Picks the most compact representation for the region between start and end.
	 */
	public static Span between(Position start, Position end) {
		if (start.getLine() == end.getLine()) {
			return new SingleLineSpan(start.getLine(), start.getCharacter(), end.getCharacter() - start.getCharacter());
		}
		return new MultiLineSpan(start.getLine(), start.getCharacter(), end.getLine(), end.getCharacter());
	}

	public static Span at(Position position) {
		return new SingleLineSpan(position.getLine(), position.getCharacter(), 0);
	}

	@Override
	public String toString() {
		return range().toString();
	}
}
