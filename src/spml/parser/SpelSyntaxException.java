package spml.parser;

import spml.model.spel.SpelSyntaxError;
import spml.model.spel.SpelSyntaxFix;

import java.util.Arrays;

/**
 * Aborts the SPEL parse attempt in progress. Never escapes {@link SpelParser}'s public entry points, which turn it
 * into an invalid {@link spml.model.spel.SpelResult}.
 */
public class SpelSyntaxException extends Exception {
	private static final long serialVersionUID = 1L;

	private final SpelSyntaxError error;

	public SpelSyntaxException(SpelSyntaxError error) {
		super(error.getMessage());
		this.error = error;
	}

	public SpelSyntaxException(String message, SpelSyntaxFix... fixes) {
		this(new SpelSyntaxError(message, Arrays.asList(fixes)));
	}

	public SpelSyntaxError getError() {
		return error;
	}
}
