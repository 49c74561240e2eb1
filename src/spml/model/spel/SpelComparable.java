package spml.model.spel;

/**
 * Anything that may appear on either side of a {@link SpelComparison}.
 */
public interface SpelComparable extends SpelElement {
}
