package spml.model.spel;

/**
 * Everything that may be passed to a function.
 */
public interface SpelArgument extends SpelElement {
}
