package spml.model.spel;

/**
 * The arithmetic expression grammar.
 */
public interface SpelExpression extends SpelComparable {
}
