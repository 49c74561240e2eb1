package spml.parser;

import spml.model.document.Parsed;
import spml.util.Ranged;
import spml.util.Span;

/**
 * Abandons the construct being parsed. The routine that started the construct catches it and records the construct
 * as {@link Parsed.Unparsable}.
 */
@SuppressWarnings("serial")
class UnparsableException extends Exception {
	private final Span span;

	UnparsableException(String message, Span span) {
		super(message);
		this.span = span;
	}

	Span getSpan() {
		return span;
	}

	<T extends Ranged> Parsed<T> toParsed() {
		return Parsed.unparsable(getMessage(), span);
	}
}
