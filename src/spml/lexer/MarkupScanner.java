package spml.lexer;

import java.util.function.IntPredicate;

/**
 * A character cursor over SPML markup, used to build syntax trees. Unlike {@link SpelScanner} it works on raw
 * offsets, since the tree nodes it helps to build are addressed by offset.
 */
public class MarkupScanner {
	private final String text;
	private int offset;

	public MarkupScanner(String text) {
		this.text = text;
		this.offset = 0;
	}

	public String getText() {
		return text;
	}

	public int getOffset() {
		return offset;
	}

	public void reset(int offset) {
		this.offset = offset;
	}

	public boolean isDone() {
		return offset >= text.length();
	}

	/**
	 * @return the character at the cursor, or 0 at the end of the text
	 */
	public char peek() {
		return peek(0);
	}

	public char peek(int ahead) {
		int position = offset + ahead;
		return position < text.length() ? text.charAt(position) : 0;
	}

	public boolean startsWith(String prefix) {
		return text.startsWith(prefix, offset);
	}

	public boolean startsWithIgnoreCase(String prefix) {
		return text.regionMatches(true, offset, prefix, 0, prefix.length());
	}

	public void advance(int characters) {
		offset = Math.min(text.length(), offset + characters);
	}

	public void skipWhitespace() {
		takeWhile(Character::isWhitespace);
	}

	/**
	 * @return the consumed characters
	 */
	public String takeWhile(IntPredicate predicate) {
		int start = offset;
		while (!isDone() && predicate.test(text.charAt(offset))) {
			offset++;
		}
		return text.substring(start, offset);
	}

	/**
	 * Advances until just past the next occurrence of the terminator, or to the end of the text.
	 *
	 * @return true if the terminator was found
	 */
	public boolean skipPast(String terminator) {
		int index = text.indexOf(terminator, offset);
		if (index < 0) {
			offset = text.length();
			return false;
		}
		offset = index + terminator.length();
		return true;
	}

	/**
	 * Like {@link #skipPast(String)}, comparing case-insensitively, but leaves the cursor in front of the terminator.
	 */
	public boolean skipUntilIgnoreCase(String terminator) {
		for (int i = offset; i + terminator.length() <= text.length(); i++) {
			if (text.regionMatches(true, i, terminator, 0, terminator.length())) {
				offset = i;
				return true;
			}
		}
		offset = text.length();
		return false;
	}
}
