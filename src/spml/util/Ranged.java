package spml.util;

/**
 * Anything parsed out of a document that can be traced back to the text it came from.
 */
public interface Ranged {

	Position start();

	Position end();

	default Range range() {
		return new Range(start(), end());
	}
}
