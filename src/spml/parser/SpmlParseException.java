package spml.parser;

/**
 * A document could not be parsed at all: it is empty, or the syntax tree is not shaped like an SPML document.
 * Malformed constructs inside a document never cause this.
 */
@SuppressWarnings("serial")
public class SpmlParseException extends Exception {

	public SpmlParseException(String message) {
		super(message);
	}
}
