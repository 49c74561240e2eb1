package spml.model.document;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.Optional;

import org.junit.BeforeClass;
import org.junit.Test;

import spml.model.schema.TagSchema;
import spml.parser.DocumentParser;
import spml.parser.SpmlParseException;
import spml.util.Position;
import spml.util.Range;

public class DocumentTest {
	private static Document document;

	@BeforeClass
	public static void parse() throws IOException, SpmlParseException {
		document = DocumentParser.parse("<div>\n  <sp:print name=\"_a\"/>\n</div>\ntail", TagSchema.load());
	}

	private static Node div() {
		return document.getNodes().get(0);
	}

	private static Node print() {
		return div().getBody().get().getNodes().get(0);
	}

	@Test
	public void nodeAtFindsInnermostNode() {
		assertThat(document.nodeAt(new Position(1, 5)), is(Optional.of(print())));
		assertThat(document.nodeAt(new Position(0, 1)), is(Optional.of(div())));
		assertThat(document.nodeAt(new Position(3, 2)), is(Optional.of(document.getNodes().get(1))));
	}

	@Test
	public void nodeAtOutsideOfAllNodes() {
		assertFalse(document.nodeAt(new Position(9, 0)).isPresent());
	}

	@Test
	public void parentOf() {
		assertThat(print(), instanceOf(TagNode.class));
		assertThat(document.parentOf(print()), is(Optional.of(div())));
		assertFalse(document.parentOf(div()).isPresent());
	}

	@Test
	public void textTouchingANestedTag() throws IOException, SpmlParseException {
		Document adjacent = DocumentParser.parse("<sp:if name=\"_a\" eq=\"b\">xy<sp:print name=\"_a\"/>\n</sp:if>",
				TagSchema.load());
		Node tag = adjacent.getNodes().get(0);
		Node text = tag.getBody().get().getNodes().get(0);
		Node print = tag.getBody().get().getNodes().get(1);
		assertThat(text, instanceOf(TextNode.class));
		assertThat(text.end(), is(print.start()));

		assertThat(adjacent.nodeAt(print.start()), is(Optional.of(print)));
		assertThat(adjacent.nodeAt(new Position(0, 25)), is(Optional.of(text)));
		assertThat(adjacent.parentOf(print), is(Optional.of(tag)));
		assertThat(adjacent.parentOf(text), is(Optional.of(tag)));
	}

	@Test
	public void parentOfNodeOutsideTheDocument() {
		Node foreign = new TextNode("zzz", new Range(new Position(1, 3), new Position(1, 6)));
		assertFalse(document.parentOf(foreign).isPresent());
	}
}
