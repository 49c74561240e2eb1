package spml.cst;

import spml.lexer.MarkupScanner;
import spml.model.schema.TagDefinition;
import spml.model.schema.TagSchema;
import spml.util.LineIndex;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds concrete syntax trees for SPML documents, shaped the way the document parser expects them from a grammar
 * oracle.
 *
 * The builder never fails. Text it cannot make sense of ends up in ERROR nodes, tokens that are allowed but do not
 * belong where they are get flagged as extra, and absent required tokens are represented by zero-width missing
 * nodes, positioned directly after the last token that is present.
 */
public class SpmlTreeBuilder {
	private static final Logger logger = Logger.getLogger(SpmlTreeBuilder.class.getName());

	private static final Set<String> VOID_ELEMENTS = new HashSet<>(Arrays.asList(
			"area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param", "source", "track",
			"wbr"));
	private static final Set<String> OPTIONAL_CLOSE_ELEMENTS = new HashSet<>(Arrays.asList(
			"p", "li", "option", "td", "th", "tr", "dt", "dd", "thead", "tbody", "tfoot", "colgroup", "optgroup",
			"rt", "rp"));
	private static final Set<String> PAGE_HEADER_FIELDS = new HashSet<>(Arrays.asList(
			"contentType", "language", "pageEncoding", "import"));
	private static final Set<String> TAGLIB_HEADER_FIELDS = new HashSet<>(Arrays.asList(
			"uri", "tagdir", "prefix"));
	private static final Pattern XML_ENTITY = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[A-Za-z][A-Za-z0-9]*);");

	private final TagSchema schema;

	public SpmlTreeBuilder(TagSchema schema) {
		this.schema = schema;
	}

	public SyntaxTree build(String text) {
		return new Build(text).run();
	}

	private enum StartTagEnd {
		SELF_CLOSING,
		OPEN,
		MISSING,
	}

	private static boolean isNameStart(char c) {
		return Character.isLetter(c) || c == '_' || c == ':' || c == '@';
	}

	private static boolean isNameCharacter(int c) {
		return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.' || c == '@';
	}

	private static boolean isJunkCharacter(int c) {
		return !Character.isWhitespace(c) && c != '>' && c != '<' && c != '"' && c != '/';
	}

	private final class Build {
		private final String text;
		private final MarkupScanner scanner;
		private final LineIndex lines;
		private final Deque<String> openElements = new ArrayDeque<>();
		// start offsets of optional-close elements whose body was already found to be unclosed
		private final Set<Integer> failedSpeculations = new HashSet<>();

		Build(String text) {
			this.text = text;
			this.scanner = new MarkupScanner(text);
			this.lines = new LineIndex(text);
		}

		SyntaxTree run() {
			TreeNode root = open("document", 0);
			parseContent(root);
			close(root, text.length());
			return new SyntaxTree(text, root);
		}

		/**
		 * Parses nodes into parent until the end of the text, or until a closing tag of an element that is currently
		 * open. That closing tag is left for the element to consume.
		 */
		private void parseContent(TreeNode parent) {
			while (true) {
				scanner.skipWhitespace();
				if (scanner.isDone()) {
					return;
				}
				if (scanner.startsWith("</")) {
					if (isOpen(closingTagName())) {
						return;
					}
					parent.add(strayClose());
				} else if (scanner.startsWith("<%--")) {
					parent.add(delimited("comment", "--%>"));
				} else if (scanner.startsWith("<!--")) {
					parent.add(delimited("xml_comment", "-->"));
				} else if (scanner.startsWithIgnoreCase("<!doctype")) {
					parent.add(delimited("html_doctype", ">"));
				} else if (scanner.startsWith("<%@")) {
					parseHeader(parent);
				} else if (scanner.startsWith("<%")) {
					parent.add(delimited("java_tag", "%>"));
				} else if (atSpmlTag()) {
					parseSpmlTag(parent);
				} else if (scanner.peek() == '<' && Character.isLetter(scanner.peek(1))) {
					parseHtmlTag(parent);
				} else if (!parseXmlEntity(parent)) {
					parseText(parent);
				}
			}
		}

		private boolean atSpmlTag() {
			return scanner.startsWith("<sp:") || scanner.startsWith("<spt:");
		}

		private String closingTagName() {
			int i = scanner.getOffset() + 2;
			int start = i;
			while (i < text.length() && isNameCharacter(text.charAt(i))) {
				i++;
			}
			return text.substring(start, i);
		}

		private boolean isOpen(String name) {
			if (name.isEmpty()) {
				return false;
			}
			for (String element : openElements) {
				if (element.equalsIgnoreCase(name)) {
					return true;
				}
			}
			return false;
		}

		private boolean isClosing(String name) {
			return scanner.startsWith("</") && closingTagName().equalsIgnoreCase(name);
		}

		private void parseText(TreeNode parent) {
			int start = scanner.getOffset();
			scanner.advance(1);
			scanner.takeWhile(c -> c != '<' && c != '&');
			int end = scanner.getOffset();
			while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
				end--;
			}
			parent.add(node("text", start, end));
		}

		private boolean parseXmlEntity(TreeNode parent) {
			if (scanner.peek() != '&') {
				return false;
			}
			Matcher matcher = XML_ENTITY.matcher(text);
			matcher.region(scanner.getOffset(), text.length());
			if (!matcher.lookingAt()) {
				return false;
			}
			parent.add(token("xml_entity", matcher.end() - matcher.start()));
			return true;
		}

		private TreeNode delimited(String kind, String terminator) {
			int start = scanner.getOffset();
			scanner.advance(1);
			scanner.skipPast(terminator);
			return node(kind, start, scanner.getOffset());
		}

		private TreeNode strayClose() {
			int start = scanner.getOffset();
			scanner.advance(2);
			scanner.takeWhile(SpmlTreeBuilder::isNameCharacter);
			if (scanner.peek() == '>') {
				scanner.advance(1);
			}
			return node("ERROR", start, scanner.getOffset()).markError();
		}

		private TreeNode junk() {
			int start = scanner.getOffset();
			scanner.advance(1);
			scanner.takeWhile(SpmlTreeBuilder::isJunkCharacter);
			return node("ERROR", start, scanner.getOffset()).markError();
		}

		private void parseHeader(TreeNode parent) {
			int start = scanner.getOffset();
			TreeNode open = token("header_open", 3);
			scanner.skipWhitespace();
			int keywordStart = scanner.getOffset();
			String keyword = scanner.takeWhile(Character::isLetter);
			String kind;
			Set<String> fields;
			if ("page".equals(keyword)) {
				kind = "page_header";
				fields = PAGE_HEADER_FIELDS;
			} else if ("taglib".equals(keyword)) {
				kind = "taglib_header";
				fields = TAGLIB_HEADER_FIELDS;
			} else {
				scanner.skipPast("%>");
				parent.add(node("ERROR", start, scanner.getOffset()).markError());
				return;
			}
			TreeNode header = parent.add(open(kind, start));
			header.add(open);
			header.add(node(keyword, keywordStart, scanner.getOffset()));
			while (true) {
				int lastEnd = header.lastChildEnd();
				scanner.skipWhitespace();
				if (scanner.startsWith("%>")) {
					header.add(token("header_close", 2));
					break;
				}
				if (scanner.startsWith("<%--")) {
					header.add(delimited("comment", "--%>").markExtra());
					continue;
				}
				if (scanner.isDone() || scanner.peek() == '<') {
					header.add(missing("header_close", lastEnd));
					break;
				}
				if (isNameStart(scanner.peek())) {
					String name = peekName();
					TreeNode attribute = header.add(parseAttribute(name + "_attribute", false));
					if (!fields.contains(name)) {
						attribute.markExtra();
					}
					continue;
				}
				header.add(junk());
			}
			close(header, header.lastChildEnd());
		}

		private String peekName() {
			int i = scanner.getOffset();
			while (i < text.length() && isNameCharacter(text.charAt(i))) {
				i++;
			}
			return text.substring(scanner.getOffset(), i);
		}

		private void parseSpmlTag(TreeNode parent) {
			int start = scanner.getOffset();
			scanner.advance(1);
			String name = scanner.takeWhile(SpmlTreeBuilder::isNameCharacter);
			Optional<TagDefinition> definition = schema.byName(name);
			if (!definition.isPresent()) {
				logger.fine("unknown tag \"" + name + "\" at " + lines.positionOf(start));
				skipStartTag();
				parent.add(node("ERROR", start, scanner.getOffset()).markError());
				return;
			}
			String kind = definition.get().getKind();
			TreeNode tag = parent.add(open(kind, start));
			tag.add(node(kind + "_open", start, scanner.getOffset()));
			if (parseStartTagRest(tag, definition.get()) == StartTagEnd.OPEN) {
				parseBody(tag, name, kind + "_close");
			}
			close(tag, tag.lastChildEnd());
		}

		private void skipStartTag() {
			boolean quoted = false;
			while (!scanner.isDone()) {
				char c = scanner.peek();
				if (c == '"') {
					quoted = !quoted;
				} else if (!quoted && c == '>') {
					scanner.advance(1);
					return;
				} else if (!quoted && c == '<') {
					return;
				}
				scanner.advance(1);
			}
		}

		private void parseHtmlTag(TreeNode parent) {
			int start = scanner.getOffset();
			scanner.advance(1);
			String name = scanner.takeWhile(SpmlTreeBuilder::isNameCharacter);
			String kind = htmlKind(name.toLowerCase(Locale.ROOT));
			TreeNode tag = parent.add(open(kind, start));
			tag.add(node(kind + "_open", start, scanner.getOffset()));
			if (parseStartTagRest(tag, null) == StartTagEnd.OPEN) {
				switch (kind) {
					case "html_void_tag":
						break;
					case "script_tag":
					case "style_tag":
						parseRawText(tag, name, kind + "_close");
						break;
					case "html_option_tag":
						parseOptionalBody(tag, start, name, kind + "_close");
						break;
					default:
						parseBody(tag, name, kind + "_close");
				}
			}
			close(tag, tag.lastChildEnd());
		}

		private String htmlKind(String name) {
			if ("script".equals(name)) {
				return "script_tag";
			}
			if ("style".equals(name)) {
				return "style_tag";
			}
			if (VOID_ELEMENTS.contains(name)) {
				return "html_void_tag";
			}
			if (OPTIONAL_CLOSE_ELEMENTS.contains(name)) {
				return "html_option_tag";
			}
			return "html_tag";
		}

		/**
		 * Parses the attributes of a start tag and its end, "/>" or ">".
		 *
		 * @param definition the schema entry of an SPML tag, or null for html tags
		 */
		private StartTagEnd parseStartTagRest(TreeNode tag, TagDefinition definition) {
			while (true) {
				int lastEnd = tag.lastChildEnd();
				scanner.skipWhitespace();
				if (scanner.startsWith("/>")) {
					tag.add(token("self_closing_tag_end", 2));
					return StartTagEnd.SELF_CLOSING;
				}
				if (scanner.peek() == '>') {
					tag.add(token(">", 1));
					return StartTagEnd.OPEN;
				}
				if (scanner.startsWith("<%--")) {
					tag.add(delimited("comment", "--%>").markExtra());
					continue;
				}
				if (scanner.isDone() || scanner.peek() == '<') {
					tag.add(missing("self_closing_tag_end", lastEnd));
					return StartTagEnd.MISSING;
				}
				if (isNameStart(scanner.peek())) {
					if (definition == null) {
						tag.add(parseAttribute("dynamic_attribute", true));
					} else {
						String name = peekName();
						TreeNode attribute = tag.add(parseAttribute(name + "_attribute", false));
						if (!definition.getAttribute(name).isPresent()) {
							attribute.markExtra();
						}
					}
					continue;
				}
				tag.add(junk());
			}
		}

		private void parseBody(TreeNode tag, String name, String closeKind) {
			openElements.push(name);
			parseContent(tag);
			openElements.pop();
			if (isClosing(name)) {
				tag.add(closingTag(closeKind));
			} else {
				tag.add(missing(closeKind, tag.lastChildEnd()));
			}
		}

		/**
		 * Elements like "p" or "li" may omit their closing tag. Their body is only kept when the closing tag is
		 * actually found, otherwise the element ends at its "&gt;" and the content goes to the parent.
		 */
		private void parseOptionalBody(TreeNode tag, int start, String name, String closeKind) {
			if (failedSpeculations.contains(start)) {
				return;
			}
			int resume = scanner.getOffset();
			int childCount = tag.getChildren().size();
			openElements.push(name);
			parseContent(tag);
			openElements.pop();
			if (isClosing(name)) {
				tag.add(closingTag(closeKind));
				return;
			}
			failedSpeculations.add(start);
			tag.truncate(childCount);
			scanner.reset(resume);
		}

		private void parseRawText(TreeNode tag, String name, String closeKind) {
			int start = scanner.getOffset();
			boolean closed = scanner.skipUntilIgnoreCase("</" + name);
			int end = scanner.getOffset();
			while (start < end && Character.isWhitespace(text.charAt(start))) {
				start++;
			}
			while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
				end--;
			}
			if (start < end) {
				tag.add(node("text", start, end));
			}
			if (closed) {
				tag.add(closingTag(closeKind));
			} else {
				tag.add(missing(closeKind, tag.lastChildEnd()));
			}
		}

		private TreeNode closingTag(String kind) {
			int start = scanner.getOffset();
			scanner.advance(2);
			scanner.takeWhile(SpmlTreeBuilder::isNameCharacter);
			scanner.skipWhitespace();
			if (scanner.peek() == '>') {
				scanner.advance(1);
			}
			return node(kind, start, scanner.getOffset());
		}

		private TreeNode parseAttribute(String kind, boolean nestedTags) {
			int start = scanner.getOffset();
			TreeNode attribute = open(kind, start);
			scanner.takeWhile(SpmlTreeBuilder::isNameCharacter);
			attribute.add(node("attribute_name", start, scanner.getOffset()));
			int afterName = scanner.getOffset();
			scanner.skipWhitespace();
			if (scanner.peek() != '=') {
				scanner.reset(afterName);
				close(attribute, afterName);
				return attribute;
			}
			attribute.add(token("=", 1));
			int afterEquals = scanner.getOffset();
			scanner.skipWhitespace();
			char c = scanner.peek();
			if (c == '"') {
				attribute.add(parseString(nestedTags));
			} else if (c == '\'') {
				int valueStart = scanner.getOffset();
				scanner.advance(1);
				scanner.takeWhile(ch -> ch != '\'' && ch != '\n');
				if (scanner.peek() == '\'') {
					scanner.advance(1);
				}
				attribute.add(node("ERROR", valueStart, scanner.getOffset()).markError());
			} else if (scanner.isDone() || c == '>' || c == '<' || scanner.startsWith("/>")) {
				scanner.reset(afterEquals);
				attribute.add(missing("string", afterEquals));
			} else {
				int valueStart = scanner.getOffset();
				scanner.takeWhile(ch -> !Character.isWhitespace(ch) && ch != '>' && ch != '<' && ch != '"');
				if (scanner.getOffset() > valueStart + 1 && text.charAt(scanner.getOffset() - 1) == '/'
						&& scanner.peek() == '>') {
					scanner.reset(scanner.getOffset() - 1);
				}
				attribute.add(node("ERROR", valueStart, scanner.getOffset()).markError());
			}
			close(attribute, attribute.lastChildEnd());
			return attribute;
		}

		private TreeNode parseString(boolean nestedTags) {
			TreeNode string = open("string", scanner.getOffset());
			string.add(token("\"", 1));
			while (true) {
				if (scanner.isDone()) {
					string.add(missing("\"", scanner.getOffset()));
					break;
				}
				if (scanner.peek() == '"') {
					string.add(token("\"", 1));
					break;
				}
				if (nestedTags && atSpmlTag()) {
					parseSpmlTag(string);
					continue;
				}
				int contentStart = scanner.getOffset();
				do {
					scanner.advance(1);
				} while (!scanner.isDone() && scanner.peek() != '"' && !(nestedTags && atSpmlTag()));
				string.add(node("string_content", contentStart, scanner.getOffset()));
			}
			close(string, string.lastChildEnd());
			return string;
		}

		private TreeNode open(String kind, int start) {
			return new TreeNode(kind, start, lines.positionOf(start));
		}

		private void close(TreeNode node, int end) {
			node.finish(end, lines.positionOf(end));
		}

		private TreeNode node(String kind, int start, int end) {
			TreeNode node = open(kind, start);
			close(node, end);
			return node;
		}

		private TreeNode token(String kind, int length) {
			int start = scanner.getOffset();
			scanner.advance(length);
			return node(kind, start, scanner.getOffset());
		}

		private TreeNode missing(String kind, int offset) {
			return node(kind, offset, offset).markMissing();
		}
	}
}
