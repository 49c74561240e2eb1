package spml.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts between character offsets and {@link Position}s of a fixed text.
 */
public class LineIndex {
	private final String text;
	private final List<Integer> lineStarts;

	public LineIndex(String text) {
		this.text = text;
		this.lineStarts = new ArrayList<>();
		lineStarts.add(0);
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				lineStarts.add(i + 1);
			}
		}
	}

	public String getText() {
		return text;
	}

	public int lineCount() {
		return lineStarts.size();
	}

	public Position positionOf(int offset) {
		if (offset < 0 || offset > text.length()) {
			throw new IndexOutOfBoundsException("offset " + offset + " outside of text of length " + text.length());
		}
		int search = Collections.binarySearch(lineStarts, offset);
		int line = search >= 0 ? search : -search - 2;
		return new Position(line, offset - lineStarts.get(line));
	}

	public int offsetOf(Position position) {
		if (position.getLine() >= lineStarts.size()) {
			return text.length();
		}
		int lineStart = lineStarts.get(position.getLine());
		return Math.min(lineStart + position.getCharacter(), lineEnd(position.getLine()));
	}

	/**
	 * @return the offset just past the last character of the line, not counting its line break
	 */
	public int lineEnd(int line) {
		if (line + 1 < lineStarts.size()) {
			int end = lineStarts.get(line + 1) - 1;
			if (end > lineStarts.get(line) && text.charAt(end - 1) == '\r') {
				end--;
			}
			return end;
		}
		return text.length();
	}

	public String textOf(Ranged ranged) {
		return text.substring(offsetOf(ranged.start()), offsetOf(ranged.end()));
	}
}
