package spml.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import org.junit.BeforeClass;
import org.junit.Test;

import spml.cst.SyntaxNode;
import spml.cst.SyntaxNodeBuilder;
import spml.errors.ParseIssue;
import spml.model.document.Document;
import spml.model.document.ErrorNode;
import spml.model.document.ExpressionAttribute;
import spml.model.document.HtmlAttribute;
import spml.model.document.HtmlAttributeValueContent;
import spml.model.document.HtmlAttributeValueFragment;
import spml.model.document.HtmlElement;
import spml.model.document.HtmlNode;
import spml.model.document.Node;
import spml.model.document.PageHeader;
import spml.model.document.Parsed;
import spml.model.document.PlainAttribute;
import spml.model.document.Tag;
import spml.model.document.TagLibImport;
import spml.model.document.TagLibOrigin;
import spml.model.document.TagNode;
import spml.model.document.TextNode;
import spml.model.schema.TagSchema;
import spml.model.spel.SpelComparison;
import spml.model.spel.SpelSource;
import spml.util.LineIndex;
import spml.util.Position;
import spml.util.SingleLineSpan;

public class DocumentParserTest {
	private static final String PAGE_HEADER =
			"<%@ page language=\"java\" pageEncoding=\"UTF-8\" contentType=\"text/html; charset=UTF-8\"\n";

	private static TagSchema schema;

	@BeforeClass
	public static void loadSchema() throws IOException {
		schema = TagSchema.load();
	}

	private static Document parse(String text) throws SpmlParseException {
		return DocumentParser.parse(text, schema);
	}

	private static Parsed<Tag> parsedTag(Node node) {
		assertThat(node, instanceOf(TagNode.class));
		return ((TagNode) node).getTag();
	}

	private static Tag tag(Node node) {
		return parsedTag(node).getValue().get();
	}

	private static Parsed<HtmlElement> parsedHtml(Node node) {
		assertThat(node, instanceOf(HtmlNode.class));
		return ((HtmlNode) node).getElement();
	}

	private static void assertAttribute(Parsed<ExpressionAttribute> parsed, SingleLineSpan key, SingleLineSpan equals,
	                                    SingleLineSpan openingQuote, SingleLineSpan closingQuote) {
		assertTrue(parsed.toString(), parsed.isValid());
		ExpressionAttribute attribute = parsed.getValue().get();
		assertThat(attribute.getKey().getSpan(), is(key));
		assertThat(attribute.getValue().getEquals(), is(equals));
		assertThat(attribute.getValue().getOpeningQuote(), is(openingQuote));
		assertThat(attribute.getValue().getClosingQuote(), is(closingQuote));
	}

	private static void assertPlain(Parsed<PlainAttribute> parsed, SingleLineSpan key, SingleLineSpan equals,
	                                SingleLineSpan openingQuote, String content, SingleLineSpan closingQuote) {
		assertTrue(parsed.toString(), parsed.isValid());
		PlainAttribute attribute = parsed.getValue().get();
		assertThat(attribute.getKey().getSpan(), is(key));
		assertThat(attribute.getValue(), is(new PlainAttribute.Value(equals, openingQuote, content, closingQuote)));
	}

	@Test
	public void header() throws SpmlParseException {
		Document document = parse(PAGE_HEADER
				+ "%><%@ taglib uri=\"http://www.sitepark.com/taglibs/core\" prefix=\"sp\"\n"
				+ "%><%@ taglib tagdir=\"/WEB-INF/tags/spt\" prefix=\"spt\"\n"
				+ "%>\n");

		assertThat(document.getHeader().getPageHeaders().size(), is(1));
		Parsed<PageHeader> parsedPage = document.getHeader().getPageHeaders().get(0);
		assertTrue(parsedPage.isValid());
		PageHeader page = parsedPage.getValue().get();
		assertThat(page.getOpenBracket(), is(new SingleLineSpan(0, 0, 3)));
		assertThat(page.getPage(), is(new SingleLineSpan(0, 4, 4)));
		assertPlain(page.getLanguage().get(), new SingleLineSpan(0, 9, 8), new SingleLineSpan(0, 17, 1),
				new SingleLineSpan(0, 18, 1), "java", new SingleLineSpan(0, 23, 1));
		assertPlain(page.getPageEncoding().get(), new SingleLineSpan(0, 25, 12), new SingleLineSpan(0, 37, 1),
				new SingleLineSpan(0, 38, 1), "UTF-8", new SingleLineSpan(0, 44, 1));
		assertPlain(page.getContentType().get(), new SingleLineSpan(0, 46, 11), new SingleLineSpan(0, 57, 1),
				new SingleLineSpan(0, 58, 1), "text/html; charset=UTF-8", new SingleLineSpan(0, 83, 1));
		assertTrue(page.getImports().isEmpty());
		assertThat(page.getCloseBracket(), is(new SingleLineSpan(1, 0, 2)));

		List<Parsed<TagLibImport>> tagLibs = document.getHeader().getTagLibImports();
		assertThat(tagLibs.size(), is(2));

		TagLibImport core = tagLibs.get(0).getValue().get();
		assertTrue(tagLibs.get(0).isValid());
		assertThat(core.getOpenBracket(), is(new SingleLineSpan(1, 2, 3)));
		assertThat(core.getTaglib(), is(new SingleLineSpan(1, 6, 6)));
		assertThat(core.getOrigin().get(), instanceOf(TagLibOrigin.Uri.class));
		assertPlain(core.getOrigin().get().getAttribute(), new SingleLineSpan(1, 13, 3), new SingleLineSpan(1, 16, 1),
				new SingleLineSpan(1, 17, 1), "http://www.sitepark.com/taglibs/core", new SingleLineSpan(1, 54, 1));
		assertPlain(core.getPrefix().get(), new SingleLineSpan(1, 56, 6), new SingleLineSpan(1, 62, 1),
				new SingleLineSpan(1, 63, 1), "sp", new SingleLineSpan(1, 66, 1));
		assertThat(core.getCloseBracket(), is(new SingleLineSpan(2, 0, 2)));

		TagLibImport tags = tagLibs.get(1).getValue().get();
		assertThat(tags.getOpenBracket(), is(new SingleLineSpan(2, 2, 3)));
		assertThat(tags.getTaglib(), is(new SingleLineSpan(2, 6, 6)));
		assertThat(tags.getOrigin().get(), instanceOf(TagLibOrigin.TagDir.class));
		assertPlain(tags.getOrigin().get().getAttribute(), new SingleLineSpan(2, 13, 6), new SingleLineSpan(2, 19, 1),
				new SingleLineSpan(2, 20, 1), "/WEB-INF/tags/spt", new SingleLineSpan(2, 38, 1));
		assertPlain(tags.getPrefix().get(), new SingleLineSpan(2, 40, 6), new SingleLineSpan(2, 46, 1),
				new SingleLineSpan(2, 47, 1), "spt", new SingleLineSpan(2, 51, 1));
		assertThat(tags.getCloseBracket(), is(new SingleLineSpan(3, 0, 2)));

		assertTrue(document.getNodes().isEmpty());
	}

	@Test
	public void selfClosingTag() throws SpmlParseException {
		Document document = parse(PAGE_HEADER
				+ "%>\n"
				+ "<sp:barcode name=\"_testName\" text=\"some text\" scope=\"page\"/>\n");

		assertThat(document.getNodes().size(), is(1));
		Parsed<Tag> parsed = parsedTag(document.getNodes().get(0));
		assertTrue(parsed.isValid());
		Tag barcode = parsed.getValue().get();
		assertThat(barcode.getName(), is("sp:barcode"));
		assertThat(barcode.getOpen(), is(new SingleLineSpan(2, 0, 11)));
		assertThat(barcode.getClose(), is(new SingleLineSpan(2, 58, 2)));
		assertFalse(barcode.getBody().isPresent());
		assertThat(barcode.getAttributes().keySet(), is(new LinkedHashSet<>(
				Arrays.asList("name", "text", "scope"))));
		assertAttribute(barcode.getAttribute("name").get(), new SingleLineSpan(2, 12, 4),
				new SingleLineSpan(2, 16, 1), new SingleLineSpan(2, 17, 1), new SingleLineSpan(2, 27, 1));
		assertAttribute(barcode.getAttribute("text").get(), new SingleLineSpan(2, 29, 4),
				new SingleLineSpan(2, 33, 1), new SingleLineSpan(2, 34, 1), new SingleLineSpan(2, 44, 1));
		assertAttribute(barcode.getAttribute("scope").get(), new SingleLineSpan(2, 46, 5),
				new SingleLineSpan(2, 51, 1), new SingleLineSpan(2, 52, 1), new SingleLineSpan(2, 57, 1));
	}

	@Test
	public void tagsInHtmlAttributeValues() throws SpmlParseException {
		Document document = parse(PAGE_HEADER
				+ "%>\n"
				+ "<div class=\"<sp:print name=\"_class\"/> centered\">");

		Parsed<HtmlElement> parsed = parsedHtml(document.getNodes().get(0));
		assertThat(parsed.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.missing("</div>", new SingleLineSpan(2, 48, 0)))));
		HtmlElement div = parsed.getValue().get();
		assertThat(div.getName(), is("div"));
		assertThat(div.getClose(), is(new SingleLineSpan(2, 48, 0)));

		Parsed<HtmlAttribute> parsedAttribute = div.getAttributes().get(0);
		assertTrue(parsedAttribute.isValid());
		HtmlAttribute attribute = parsedAttribute.getValue().get();
		assertThat(attribute.getKey().getValue(), is("class"));
		assertThat(attribute.getKey().getSpan(), is(new SingleLineSpan(2, 5, 5)));
		HtmlAttribute.Value value = attribute.getValue().get();
		assertThat(value.getEquals(), is(new SingleLineSpan(2, 10, 1)));
		assertThat(value.getOpeningQuote(), is(new SingleLineSpan(2, 11, 1)));
		assertThat(value.getClosingQuote(), is(new SingleLineSpan(2, 46, 1)));

		assertThat(value.getContent(), instanceOf(HtmlAttributeValueContent.Fragmented.class));
		List<HtmlAttributeValueFragment> fragments = value.getContent().getFragments();
		assertThat(fragments.size(), is(2));
		Parsed<Tag> print = ((HtmlAttributeValueFragment.TagFragment) fragments.get(0)).getTag();
		assertTrue(print.isValid());
		assertThat(print.getValue().get().getOpen(), is(new SingleLineSpan(2, 12, 9)));
		assertThat(print.getValue().get().getClose(), is(new SingleLineSpan(2, 35, 2)));
		assertThat(print.getValue().get().getAttribute("name").get().getValue().get().getKey().getSpan(),
				is(new SingleLineSpan(2, 22, 4)));
		assertThat(fragments.get(1), is((HtmlAttributeValueFragment) new HtmlAttributeValueFragment.Plain(" centered")));

		assertThat(document.findTagInAttributes(div, new Position(2, 15)), is(Optional.of(print)));
		assertFalse(document.findTagInAttributes(div, new Position(2, 40)).isPresent());
	}

	@Test
	public void optionalCloseElementWithoutBody() throws SpmlParseException {
		Document document = parse(PAGE_HEADER
				+ "%>\n"
				+ "<p class=\"<sp:print name=\"_class\"/> centered\">");

		Parsed<HtmlElement> parsed = parsedHtml(document.getNodes().get(0));
		assertTrue(parsed.isValid());
		HtmlElement p = parsed.getValue().get();
		assertThat(p.getOpen(), is(new SingleLineSpan(2, 0, 2)));
		assertFalse(p.getBody().isPresent());
		assertThat(p.getClose(), is(new SingleLineSpan(2, 45, 1)));
		HtmlAttribute.Value value = p.getAttributes().get(0).getValue().get().getValue().get();
		assertThat(value.getClosingQuote(), is(new SingleLineSpan(2, 44, 1)));
		Parsed<Tag> print = ((HtmlAttributeValueFragment.TagFragment) value.getContent().getFragments().get(0)).getTag();
		assertThat(print.getValue().get().getClose(), is(new SingleLineSpan(2, 33, 2)));
	}

	@Test
	public void optionalCloseElementsInList() throws SpmlParseException {
		Document document = parse("<ul><li>one<li>two</ul>");
		HtmlElement ul = parsedHtml(document.getNodes().get(0)).getValue().get();
		List<Node> items = ul.getBody().get().getNodes();
		assertThat(items.size(), is(4));
		assertThat(parsedHtml(items.get(0)).getValue().get().getName(), is("li"));
		assertThat(((TextNode) items.get(1)).getContent(), is("one"));
		assertThat(parsedHtml(items.get(2)).getValue().get().getName(), is("li"));
		assertThat(((TextNode) items.get(3)).getContent(), is("two"));
		assertThat(ul.getClose(), is(new SingleLineSpan(0, 18, 5)));
	}

	@Test
	public void deeplyNestedTags() throws SpmlParseException {
		Document document = parse(
				"<%@page language=\"java\" pageEncoding=\"UTF-8\" contentType=\"text/htm/>/>l; charset=UTF-8\"\n"
						+ "%><%@ taglib uri=\"http://www.sitepark.com/taglibs/core\" prefix=\"sp\"\n"
						+ "%><%@ taglib tagdir=\"/WEB-INF/tags/spt\" prefix=\"spt\"\n"
						+ "%>\n"
						+ "<sp:condition>\n"
						+ "\t<sp:if name=\"_test\" neq=\"_test1\">\n"
						+ "\t\t<sp:condition>\n"
						+ "\t\t\t<sp:if name=\"_test\" neq=\"_test3\">\n"
						+ "\t\t\t\t<sp:condition>\n"
						+ "\t\t\t\t\t<sp:if name=\"_test\" neq=\"_test4\">\n"
						+ "\t\t\t\t\t\t<sp:condition>\n"
						+ "\t\t\t\t\t\t\t<sp:if name=\"_test\" neq=\"_test5\">\n"
						+ "\t\t\t\t\t\t\t\t<sp:condition>\n"
						+ "\t\t\t\t\t\t\t\t\t<sp:if name=\"_test\" neq=\"_test5\">\n"
						+ "\t\t\t\t\t\t\t\t\t\t<sp:condition>\n"
						+ "\t\t\t\t\t\t\t\t\t\t\t<sp:if name=\"_test\" neq=\"_test6\">\n"
						+ "\t\t\t\t\t\t\t\t\t\t\t\t<sp:print value=\"success!\"\n"
						+ "\t\t\t\t\t\t\t\t\t\t\t</sp:if>\n"
						+ "\t\t\t\t\t\t\t\t\t\t</sp:condition>\n"
						+ "\t\t\t\t\t\t\t\t\t</sp:if>\n"
						+ "\t\t\t\t\t\t\t\t</sp:condition>\n"
						+ "\t\t\t\t\t\t\t</sp:if>\n"
						+ "\t\t\t\t\t\t</sp:condition>\n"
						+ "\t\t\t\t\t</sp:if>\n"
						+ "\t\t\t\t</sp:condition>\n"
						+ "\t\t\t</sp:if>\n"
						+ "\t\t</sp:condition>\n"
						+ "\t</sp:if>\n"
						+ "</sp:condition>\n");

		assertTrue(document.getHeader().getPageHeaders().get(0).isValid());
		assertThat(document.getNodes().size(), is(1));
		Node node = document.getNodes().get(0);
		assertTrue(parsedTag(node).isValid());
		for (int depth = 0; depth < 12; depth++) {
			Tag tag = tag(node);
			assertThat(tag.getName(), is(depth % 2 == 0 ? "sp:condition" : "sp:if"));
			assertThat(tag.getBody().get().getNodes().size(), is(1));
			node = tag.getBody().get().getNodes().get(0);
		}
		Parsed<Tag> print = parsedTag(node);
		assertThat(print.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.superfluous("value=\"success!\"", new SingleLineSpan(16, 22, 16)),
				ParseIssue.missing("/>", new SingleLineSpan(16, 38, 0)))));
		assertThat(print.getValue().get().getClose(), is(new SingleLineSpan(17, 11, 0)));
		assertTrue(print.getValue().get().getAttributes().isEmpty());
	}

	@Test
	public void unclosedTag() throws SpmlParseException {
		Document document = parse("<sp:if name=\"_a\" eq=\"b\">\n  hello\n");
		Parsed<Tag> parsed = parsedTag(document.getNodes().get(0));
		assertThat(parsed.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.missing("</sp:if>", new SingleLineSpan(1, 7, 0)))));
		Tag tag = parsed.getValue().get();
		assertThat(tag.getClose(), is(new SingleLineSpan(1, 7, 0)));
		List<Node> body = tag.getBody().get().getNodes();
		assertThat(body.size(), is(1));
		assertThat(((TextNode) body.get(0)).getContent(), is("hello"));
	}

	@Test
	public void closedTagWithBody() throws SpmlParseException {
		Document document = parse("<sp:if name=\"_a\">\n  <b>x</b> y\n</sp:if>");
		Parsed<Tag> parsed = parsedTag(document.getNodes().get(0));
		assertTrue(parsed.isValid());
		Tag tag = parsed.getValue().get();
		assertThat(tag.getClose(), is(new SingleLineSpan(2, 0, 8)));
		assertThat(tag.getBody().get().getOpen(), is(new SingleLineSpan(0, 16, 1)));
		List<Node> body = tag.getBody().get().getNodes();
		assertThat(body.size(), is(2));
		assertThat(parsedHtml(body.get(0)).getValue().get().getName(), is("b"));
		assertThat(((TextNode) body.get(1)).getContent(), is("y"));
	}

	@Test
	public void scriptBodyIsText() throws SpmlParseException {
		Document document = parse("<script>if (a < b) {}</script>");
		HtmlElement script = parsedHtml(document.getNodes().get(0)).getValue().get();
		assertThat(script.getName(), is("script"));
		List<Node> body = script.getBody().get().getNodes();
		assertThat(((TextNode) body.get(0)).getContent(), is("if (a < b) {}"));
		assertThat(script.getClose(), is(new SingleLineSpan(0, 21, 9)));
	}

	@Test
	public void undeclaredAttributeIsSuperfluous() throws SpmlParseException {
		Document document = parse("<sp:print name=\"_a\" foo=\"x\"/>");
		Parsed<Tag> parsed = parsedTag(document.getNodes().get(0));
		assertThat(parsed.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.superfluous("foo=\"x\"", new SingleLineSpan(0, 20, 7)))));
		assertThat(parsed.getValue().get().getClose(), is(new SingleLineSpan(0, 27, 2)));
		assertThat(parsed.getValue().get().getAttributes().keySet().size(), is(1));
	}

	@Test
	public void unparsableAttributeDoesNotAffectTag() throws SpmlParseException {
		Document document = parse("<sp:print name=_a/>");
		Parsed<Tag> parsed = parsedTag(document.getNodes().get(0));
		assertTrue(parsed.isValid());
		assertEquals(Parsed.unparsable("expected attribute value, found \"_a\"", new SingleLineSpan(0, 15, 2)),
				parsed.getValue().get().getAttribute("name").get());
	}

	@Test
	public void voidElement() throws SpmlParseException {
		Document document = parse("<br>");
		HtmlElement br = parsedHtml(document.getNodes().get(0)).getValue().get();
		assertThat(br.getClose(), is(new SingleLineSpan(0, 3, 1)));
		assertFalse(br.getBody().isPresent());
	}

	@Test
	public void htmlAttributeWithoutValue() throws SpmlParseException {
		Document document = parse("<input disabled>");
		Parsed<HtmlAttribute> attribute = parsedHtml(document.getNodes().get(0)).getValue().get().getAttributes().get(0);
		assertTrue(attribute.isValid());
		assertThat(attribute.getValue().get().getKey().getValue(), is("disabled"));
		assertFalse(attribute.getValue().get().getValue().isPresent());
	}

	@Test
	public void plainHtmlAttributeValue() throws SpmlParseException {
		Document document = parse("<a href=\"/x\">link</a>");
		HtmlAttribute attribute = parsedHtml(document.getNodes().get(0)).getValue().get().getAttributes().get(0)
				.getValue().get();
		assertThat(attribute.getValue().get().getContent(),
				is((HtmlAttributeValueContent) new HtmlAttributeValueContent.Plain("/x")));
	}

	@Test
	public void strayClosingTagBecomesErrorNode() throws SpmlParseException {
		Document document = parse("<div></span></div>");
		Parsed<HtmlElement> div = parsedHtml(document.getNodes().get(0));
		assertTrue(div.isValid());
		List<Node> body = div.getValue().get().getBody().get().getNodes();
		assertThat(body.size(), is(1));
		assertThat(((ErrorNode) body.get(0)).getContent(), is("</span>"));
	}

	@Test
	public void unknownTagBecomesErrorNode() throws SpmlParseException {
		Document document = parse("<sp:nope a=\"b\"/>text");
		assertThat(document.getNodes().size(), is(2));
		assertThat(document.getNodes().get(0), instanceOf(ErrorNode.class));
		assertThat(((TextNode) document.getNodes().get(1)).getContent(), is("text"));
	}

	@Test
	public void textAndEntitiesAreMerged() throws SpmlParseException {
		Document document = parse("a &amp; b");
		assertThat(document.getNodes().size(), is(1));
		assertThat(((TextNode) document.getNodes().get(0)).getContent(), is("a &amp; b"));
	}

	@Test
	public void unterminatedHeader() throws SpmlParseException {
		Document document = parse("<%@ page language=\"java\"");
		Parsed<PageHeader> header = document.getHeader().getPageHeaders().get(0);
		assertThat(header.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.missing("%>", new SingleLineSpan(0, 24, 0)))));
		assertTrue(document.getNodes().isEmpty());
	}

	@Test
	public void unknownHeaderIsErrorNode() throws SpmlParseException {
		Document document = parse("<%@ include file=\"x.jsp\" %>");
		assertTrue(document.getHeader().getPageHeaders().isEmpty());
		assertThat(document.getNodes().get(0), instanceOf(ErrorNode.class));
	}

	@Test
	public void emptyDocument() {
		for (String text : Arrays.asList("", "  \n")) {
			try {
				parse(text);
				fail("expected an exception for \"" + text + "\"");
			} catch (SpmlParseException e) {
				assertThat(e.getMessage(), is("document is empty"));
			}
		}
	}

	@Test
	public void rootMustBeDocument() {
		SyntaxNodeBuilder b = new SyntaxNodeBuilder("<br>");
		SyntaxNode root = b.node("html_void_tag", 0, 4);
		try {
			DocumentParser.parse(b.tree(root), schema);
			fail("expected an exception");
		} catch (SpmlParseException e) {
			assertThat(e.getMessage(), is("missplaced cursor, expected a document but found \"html_void_tag\""));
		}
	}

	@Test
	public void tagWithoutChildren() {
		SyntaxNodeBuilder b = new SyntaxNodeBuilder("<sp:if>");
		SyntaxNode root = b.node("document", 0, 7, b.node("if_tag", 0, 7));
		try {
			DocumentParser.parse(b.tree(root), schema);
			fail("expected an exception");
		} catch (SpmlParseException e) {
			assertThat(e.getMessage(), is("tag is empty at 1:1"));
		}
	}

	@Test
	public void parsingIsDeterministic() throws SpmlParseException {
		String text = PAGE_HEADER + "%>\n<sp:if name=\"_a\"><div class=\"<sp:print name=\"_b\"/>\">x &lt; y</div>";
		assertThat(parse(text), is(parse(text)));
	}

	@Test
	public void expressionSpansFollowLineBreaks() throws SpmlParseException {
		String text = "<sp:if condition=\"${a} ==\n  'b'\">x</sp:if>";
		Document document = parse(text);
		ExpressionAttribute.Value value = tag(document.getNodes().get(0)).getAttribute("condition").get()
				.getValue().get().getValue();
		assertTrue(value.getSpel().isValid());
		SpelComparison comparison = (SpelComparison) value.getSpel().getResult().getRoot().get();
		SpelSource source = value.getSpelSource();
		LineIndex lines = new LineIndex(text);

		assertThat(source.spanOf(comparison.getLeft()), is(new SingleLineSpan(0, 18, 4)));
		assertThat(lines.textOf(source.spanOf(comparison.getLeft())), is("${a}"));
		assertThat(lines.textOf(source.spanOf(comparison.getOperatorLocation())), is("=="));
		assertThat(source.spanOf(comparison.getRight()), is(new SingleLineSpan(1, 2, 3)));
		assertThat(lines.textOf(source.spanOf(comparison.getRight())), is("'b'"));
		assertThat(lines.textOf(source.spanOf(comparison)), is("${a} ==\n  'b'"));
		assertThat(value.getClosingQuote(), is(new SingleLineSpan(1, 5, 1)));
	}

	@Test
	public void repeatedAttributeIsSuperfluous() throws SpmlParseException {
		Parsed<Tag> parsed = parsedTag(parse("<sp:print name=\"_a\" name=\"_b\"/>").getNodes().get(0));
		assertThat(parsed.getIssues(), is(Arrays.<ParseIssue>asList(
				ParseIssue.superfluous("name=\"_b\"", new SingleLineSpan(0, 20, 9)))));
		ExpressionAttribute name = parsed.getValue().get().getAttribute("name").get().getValue().get();
		assertThat(name.getKey().getSpan(), is(new SingleLineSpan(0, 10, 4)));
		assertThat(parsed.getValue().get().getClose(), is(new SingleLineSpan(0, 29, 2)));
	}
}
