package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The children of a tag or html element, starting at the "&gt;" of its start tag.
 */
public class TagBody implements Ranged {
	private final SingleLineSpan open;
	private final List<Node> nodes;

	public TagBody(SingleLineSpan open, List<Node> nodes) {
		this.open = open;
		this.nodes = Collections.unmodifiableList(nodes);
	}

	public SingleLineSpan getOpen() {
		return open;
	}

	public List<Node> getNodes() {
		return nodes;
	}

	@Override
	public Position start() {
		return open.start();
	}

	@Override
	public Position end() {
		if (nodes.isEmpty()) {
			return open.end();
		}
		return nodes.get(nodes.size() - 1).end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TagBody tagBody = (TagBody) o;
		return open.equals(tagBody.open) && nodes.equals(tagBody.nodes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(open, nodes);
	}
}
