package spml.model.document;

import spml.util.Ranged;

import java.util.Optional;

/**
 * One entry of a document's or a body's node sequence.
 */
public abstract class Node implements Ranged {

	Node() {
	}

	public abstract <T, E extends Throwable> T accept(NodeVisitor<T, E> v) throws E;

	/**
	 * @return the body of a tag or html element that could be parsed, if it has one
	 */
	public abstract Optional<TagBody> getBody();
}
