package spml.util;

import java.util.Objects;

public class Range {
	private final Position start;
	private final Position end;

	public Range(Position start, Position end) {
		this.start = start;
		this.end = end;
	}

	public Position getStart() {
		return start;
	}

	public Position getEnd() {
		return end;
	}

	/**
	 * @param position the position to test
	 * @return true if position lies between start and end, both inclusive
	 */
	public boolean contains(Position position) {
		return start.compareTo(position) <= 0 && end.compareTo(position) >= 0;
	}

	public boolean isEmpty() {
		return start.equals(end);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Range range = (Range) o;
		return start.equals(range.start) && end.equals(range.end);
	}

	@Override
	public int hashCode() {
		return Objects.hash(start, end);
	}

	@Override
	public String toString() {
		return start + "-" + end;
	}
}
