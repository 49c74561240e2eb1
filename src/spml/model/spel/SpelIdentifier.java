package spml.model.spel;

/**
 * A dotted variable name, e.g. <code>a.b.c</code>.
 */
public interface SpelIdentifier extends SpelElement {
}
