package spml.lexer;

import java.util.Optional;
import java.util.function.Function;

/**
 * A character cursor over a SPEL text. There is no separate tokenizer: the parser pulls characters directly.
 *
 * Characters are consumed for good unless the caller took a {@link #mark()} beforehand and {@link #reset(int)}s to
 * it.
 */
public class SpelScanner {
	private final String characters;
	private int cursor;

	public SpelScanner(String text) {
		this.characters = text;
		this.cursor = 0;
	}

	public int getCursor() {
		return cursor;
	}

	public int length() {
		return characters.length();
	}

	/**
	 * @return true if further progress is not possible
	 */
	public boolean isDone() {
		return cursor >= characters.length();
	}

	/**
	 * @return the next character without advancing, if there is one
	 */
	public Optional<Character> peek() {
		if (isDone()) {
			return Optional.empty();
		}
		return Optional.of(characters.charAt(cursor));
	}

	public boolean peekIs(char c) {
		return !isDone() && characters.charAt(cursor) == c;
	}

	/**
	 * @return the next character, if there is one, advancing past it
	 */
	public Optional<Character> pop() {
		Optional<Character> result = peek();
		if (result.isPresent()) {
			cursor++;
		}
		return result;
	}

	/**
	 * Advances past target if it is the next character.
	 *
	 * @return whether the cursor moved
	 */
	public boolean take(char target) {
		if (peekIs(target)) {
			cursor++;
			return true;
		}
		return false;
	}

	/**
	 * Advances past target if the remaining text starts with it. Leaves the cursor unchanged otherwise.
	 */
	public boolean take(String target) {
		if (characters.startsWith(target, cursor)) {
			cursor += target.length();
			return true;
		}
		return false;
	}

	/**
	 * @return true if any whitespace was skipped
	 */
	public boolean skipWhitespace() {
		int start = cursor;
		while (!isDone() && Character.isWhitespace(characters.charAt(cursor))) {
			cursor++;
		}
		return cursor > start;
	}

	/**
	 * Applies fn to the next character. If it produces a value the cursor advances past the character.
	 */
	public <T> Optional<T> transform(Function<Character, Optional<T>> fn) {
		if (isDone()) {
			return Optional.empty();
		}
		Optional<T> result = fn.apply(characters.charAt(cursor));
		if (result.isPresent()) {
			cursor++;
		}
		return result;
	}

	/**
	 * @return the index of the last non-whitespace character before the cursor, or 0
	 */
	public int subtractWhitespace() {
		int index = cursor == 0 ? 0 : cursor - 1;
		while (index > 0 && Character.isWhitespace(characters.charAt(index))) {
			index--;
		}
		return index;
	}

	/**
	 * @return everything from the cursor to the end of the text
	 */
	public String rest() {
		return characters.substring(Math.min(cursor, characters.length()));
	}

	public String substring(int start, int end) {
		return characters.substring(start, end);
	}

	public int mark() {
		return cursor;
	}

	public void reset(int mark) {
		if (mark < 0 || mark > characters.length()) {
			throw new IllegalArgumentException("mark " + mark + " is outside of the scanned text");
		}
		cursor = mark;
	}
}
