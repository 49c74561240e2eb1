package spml.model.schema;

import spml.model.spel.SpelGrammar;

/**
 * The category of an attribute value, which decides the SPEL grammar it is parsed with.
 */
public enum TagAttributeType {
	COMPARABLE(SpelGrammar.COMPARABLE),
	CONDITION(SpelGrammar.CONDITION),
	EXPRESSION(SpelGrammar.EXPRESSION),
	IDENTIFIER(SpelGrammar.IDENTIFIER),
	MODULE(SpelGrammar.WORD),
	OBJECT(SpelGrammar.OBJECT),
	QUERY(SpelGrammar.QUERY),
	REGEX(SpelGrammar.REGEX),
	STRING(SpelGrammar.WORD),
	URI(SpelGrammar.URI);

	private final SpelGrammar grammar;

	TagAttributeType(SpelGrammar grammar) {
		this.grammar = grammar;
	}

	public SpelGrammar getGrammar() {
		return grammar;
	}
}
