package spml.model.document;

import spml.util.Position;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A fully parsed SPML document. Documents are values: they are built once per parse and never modified.
 */
public class Document {
	private final Header header;
	private final List<Node> nodes;

	public Document(Header header, List<Node> nodes) {
		this.header = header;
		this.nodes = Collections.unmodifiableList(nodes);
	}

	public Header getHeader() {
		return header;
	}

	public List<Node> getNodes() {
		return nodes;
	}

	/**
	 * Finds the innermost node whose range contains position, descending through the bodies of tags and html
	 * elements.
	 */
	public Optional<Node> nodeAt(Position position) {
		List<Node> candidates = nodes;
		Node current = null;
		while (true) {
			Optional<Node> found = findNodeAt(candidates, position);
			if (!found.isPresent()) {
				return Optional.ofNullable(current);
			}
			current = found.get();
			Optional<TagBody> body = current.getBody();
			if (!body.isPresent()) {
				return Optional.of(current);
			}
			candidates = body.get().getNodes();
		}
	}

	/**
	 * Finds the tag or html element whose body contains node.
	 *
	 * @return the parent, or nothing for top level nodes and nodes that are not part of this document
	 */
	public Optional<Node> parentOf(Node node) {
		Position position = node.start();
		List<Node> candidates = nodes;
		Node current = null;
		while (true) {
			for (Node candidate : candidates) {
				if (candidate == node || (candidate.start().equals(position) && candidate.equals(node))) {
					return Optional.ofNullable(current);
				}
			}
			Optional<Node> found = findNodeAt(candidates, position);
			if (!found.isPresent() || !found.get().getBody().isPresent()) {
				return Optional.empty();
			}
			current = found.get();
			candidates = current.getBody().get().getNodes();
		}
	}

	/**
	 * Finds an SPML tag embedded in an attribute value of an html element, such as the print tag in
	 * {@code <div class="<sp:print name="_class"/>">}.
	 */
	public Optional<Parsed<Tag>> findTagInAttributes(HtmlElement element, Position position) {
		for (Parsed<HtmlAttribute> parsed : element.getAttributes()) {
			Optional<HtmlAttribute.Value> value = parsed.getValue().flatMap(HtmlAttribute::getValue);
			if (!value.isPresent()) {
				continue;
			}
			if (position.isBefore(value.get().getOpeningQuote().end())
					|| position.isAfter(value.get().getClosingQuote().start())) {
				continue;
			}
			for (HtmlAttributeValueFragment fragment : value.get().getContent().getFragments()) {
				if (!(fragment instanceof HtmlAttributeValueFragment.TagFragment)) {
					continue;
				}
				Parsed<Tag> tag = ((HtmlAttributeValueFragment.TagFragment) fragment).getTag();
				if (tag.range().contains(position)) {
					return Optional.of(tag);
				}
			}
			return Optional.empty();
		}
		return Optional.empty();
	}

	/**
	 * Ranges include their end, so where one node ends and the next starts the later node wins.
	 */
	private static Optional<Node> findNodeAt(List<Node> nodes, Position position) {
		Node found = null;
		for (Node node : nodes) {
			if (position.isBefore(node.start())) {
				break;
			}
			if (!position.isAfter(node.end())) {
				found = node;
			}
		}
		return Optional.ofNullable(found);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Document document = (Document) o;
		return header.equals(document.header) && nodes.equals(document.nodes);
	}

	@Override
	public int hashCode() {
		return Objects.hash(header, nodes);
	}
}
