package spml.model.spel;

/**
 * Names, strings, anchors and function calls, with any field, method or array accesses chained onto them.
 */
public interface SpelObject extends SpelComparable {
}
