package spml.formatters;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;

import org.junit.BeforeClass;
import org.junit.Test;

import spml.model.schema.TagSchema;
import spml.parser.DocumentParser;
import spml.parser.SpmlParseException;

public class DocumentFormattingVisitorTest {
	private static TagSchema schema;

	@BeforeClass
	public static void loadSchema() throws IOException {
		schema = TagSchema.load();
	}

	private static String format(String text) throws SpmlParseException {
		return DocumentFormattingVisitor.format(DocumentParser.parse(text, schema));
	}

	@Test
	public void outline() throws SpmlParseException {
		String outline = format("<%@ taglib uri=\"u\" prefix=\"sp\" %>\n"
				+ "<sp:if name=\"_a\">hello<br></sp:if><sp:print name=_x/>");
		assertThat(outline, is(String.join("\n",
				"taglib",
				"  uri = \"u\"",
				"  prefix = \"sp\"",
				"tag sp:if",
				"  name = object: _a",
				"  text \"hello\"",
				"  html br",
				"tag sp:print",
				"  name = unparsable (expected attribute value, found \"_x\")")));
	}

	@Test
	public void erroneousConstructsShowTheirIssueCount() throws SpmlParseException {
		assertThat(format("<sp:if name=\"_a\">x"), is(String.join("\n",
				"tag sp:if erroneous (1 issue(s))",
				"  name = object: _a",
				"  text \"x\"")));
	}

	@Test
	public void htmlAttributesAndErrors() throws SpmlParseException {
		assertThat(format("<div class=\"a <sp:print name=\"_c\"/>\" hidden></div></span>"), is(String.join("\n",
				"html div",
				"  attribute class =",
				"    text \"a \"",
				"    tag sp:print",
				"      name = object: _c",
				"  attribute hidden",
				"error \"</span>\"")));
	}

	@Test
	public void invalidExpressionsAreShownWithTheirError() throws SpmlParseException {
		assertThat(format("<sp:print name=\"${_x\"/>"), is(String.join("\n",
				"tag sp:print",
				"  name = object: invalid (unclosed interpolation. try adding the missing bracket)")));
	}
}
