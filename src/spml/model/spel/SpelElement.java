package spml.model.spel;

/**
 * Common contract of every SPEL syntax element. Character offsets are relative to the start of the parsed text.
 */
public interface SpelElement {

	int getStartCharacter();

	int getEndCharacter();

	/**
	 * @return the name used for this element's kind in syntax error messages, e.g. "expression"
	 */
	String typeName();

	<T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E;

	default SpelLocation getLocation() {
		return SpelLocation.variable(getStartCharacter(), getEndCharacter() - getStartCharacter());
	}
}
