package spml.model.spel;

/**
 * The grammars a SPEL text can be parsed with. Which one applies to an attribute value is declared by the tag
 * schema.
 */
public enum SpelGrammar {
	COMPARABLE,
	CONDITION,
	EXPRESSION,
	IDENTIFIER,
	OBJECT,
	QUERY,
	REGEX,
	WORD,
	URI
}
