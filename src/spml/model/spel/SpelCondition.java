package spml.model.spel;

/**
 * The boolean condition grammar.
 */
public interface SpelCondition extends SpelComparable {
}
