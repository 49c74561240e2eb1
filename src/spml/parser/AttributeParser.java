package spml.parser;

import spml.cst.NodeMovement;
import spml.cst.NodeMovingResult;
import spml.cst.SyntaxNode;
import spml.cst.TreeCursor;
import spml.cst.TreeWalker;
import spml.errors.ParseIssue;
import spml.model.document.AttributeKey;
import spml.model.document.ExpressionAttribute;
import spml.model.document.HtmlAttribute;
import spml.model.document.HtmlAttributeValueContent;
import spml.model.document.Parsed;
import spml.model.document.PlainAttribute;
import spml.model.schema.TagAttributeType;
import spml.model.spel.SpelAst;
import spml.util.SingleLineSpan;
import spml.util.Span;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses one attribute node: key, "=", opening quote, content and closing quote, in that order.
 *
 * Superfluous nodes between the steps are recorded and skipped. Any other deviation abandons the attribute, which
 * is then {@link Parsed.Unparsable}. The cursor is back on the attribute node when an entry point returns.
 */
final class AttributeParser {
	private final TreeWalker walker;
	private final SyntaxNode parent;
	private final List<ParseIssue> issues = new ArrayList<>();

	private AttributeParser(TreeWalker walker) {
		this.walker = walker;
		this.parent = walker.node();
	}

	static Parsed<PlainAttribute> plain(TreeWalker walker) {
		try (TreeCursor.Mark ignored = walker.mark()) {
			return new AttributeParser(walker).parsePlain();
		}
	}

	static Parsed<HtmlAttribute> html(TreeWalker walker, DocumentParser documentParser) throws SpmlParseException {
		try (TreeCursor.Mark ignored = walker.mark()) {
			return new AttributeParser(walker).parseHtml(documentParser);
		}
	}

	static Parsed<ExpressionAttribute> expression(TreeWalker walker, TagAttributeType type) {
		try (TreeCursor.Mark ignored = walker.mark()) {
			return new AttributeParser(walker).parseExpression(type);
		}
	}

	private Parsed<PlainAttribute> parsePlain() {
		try {
			AttributeKey key = parseKey();
			SingleLineSpan equals = parseEquals(key).orElseThrow(this::missingEquals);
			parseString(key);
			SingleLineSpan openingQuote = parseOpeningQuote(key);
			StringContent content = parseStringContent(key);
			SingleLineSpan closingQuote = parseClosingQuote(key, content.next);
			PlainAttribute.Value value = new PlainAttribute.Value(equals, openingQuote, content.text, closingQuote);
			return Parsed.of(new PlainAttribute(key, value), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private Parsed<HtmlAttribute> parseHtml(DocumentParser documentParser) throws SpmlParseException {
		try {
			AttributeKey key = parseKey();
			Optional<SingleLineSpan> equals = parseEquals(key);
			if (!equals.isPresent()) {
				return Parsed.of(new HtmlAttribute(key, null), issues);
			}
			parseString(key);
			SingleLineSpan openingQuote = parseOpeningQuote(key);
			HtmlAttributeValueContent content = parseHtmlStringContent(key, documentParser);
			SingleLineSpan closingQuote = parseClosingQuote(key, NodeMovement.CURRENT);
			HtmlAttribute.Value value = new HtmlAttribute.Value(equals.get(), openingQuote, content, closingQuote);
			return Parsed.of(new HtmlAttribute(key, value), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private Parsed<ExpressionAttribute> parseExpression(TagAttributeType type) {
		try {
			AttributeKey key = parseKey();
			SingleLineSpan equals = parseEquals(key).orElseThrow(this::missingEquals);
			parseString(key);
			SingleLineSpan openingQuote = parseOpeningQuote(key);
			StringContent content = parseStringContent(key);
			SpelAst spel = SpelParser.parse(type.getGrammar(), content.text);
			SingleLineSpan closingQuote = parseClosingQuote(key, content.next);
			ExpressionAttribute.Value value = new ExpressionAttribute.Value(equals, openingQuote, spel, content.text,
					closingQuote);
			return Parsed.of(new ExpressionAttribute(key, value), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private UnparsableException missingEquals() {
		return new UnparsableException("missing \"=\"", TreeWalker.span(parent));
	}

	private AttributeKey parseKey() throws UnparsableException {
		NodeMovement movement = NodeMovement.FIRST_CHILD;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException("missing attribute", TreeWalker.span(parent));
				case ERRONEOUS:
					throw new UnparsableException(
							"invalid attribute \"" + text(result) + "\"", TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					superfluous(result.getNode());
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					SingleLineSpan span = singleLine(result.getNode(), "attribute key should be on a single line");
					return new AttributeKey(text(result), span);
			}
		}
	}

	/**
	 * @return the span of "=", or nothing if the attribute has no value at all
	 */
	private Optional<SingleLineSpan> parseEquals(AttributeKey key) throws UnparsableException {
		while (true) {
			NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
					return Optional.empty();
				case MISSING:
					throw new UnparsableException(
							"missing \"=\" after attribute name \"" + key.getValue() + "\"", TreeWalker.span(parent));
				case ERRONEOUS:
					throw new UnparsableException(
							"expected \"=\", found \"" + text(result) + "\"", TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					superfluous(result.getNode());
					break;
				default:
					return Optional.of(singleLine(result.getNode(), "\"=\" should be on a single line"));
			}
		}
	}

	private void parseString(AttributeKey key) throws UnparsableException {
		while (true) {
			NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException(
							"missing attribute value for \"" + key.getValue() + "\"", TreeWalker.span(parent));
				case ERRONEOUS:
					throw new UnparsableException(
							"expected attribute value, found \"" + text(result) + "\"",
							TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					superfluous(result.getNode());
					break;
				default:
					return;
			}
		}
	}

	private SingleLineSpan parseOpeningQuote(AttributeKey key) throws UnparsableException {
		NodeMovement movement = NodeMovement.FIRST_CHILD;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
					throw new UnparsableException(
							"attribute \"" + key.getValue() + "\" is missing a value", TreeWalker.span(parent));
				case MISSING:
					throw new UnparsableException(
							"missing \"\"\" after attribute name \"" + key.getValue() + "=\"",
							TreeWalker.span(parent));
				case ERRONEOUS:
					throw unexpectedQuote(result);
				case SUPERFLUOUS:
					superfluous(result.getNode());
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					return singleLine(result.getNode(), "\"\"\" should be on a single line");
			}
		}
	}

	private StringContent parseStringContent(AttributeKey key) throws UnparsableException {
		while (true) {
			NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException(
							"\"" + key.getValue() + "\" attribute value string is unclosed", TreeWalker.span(parent));
				case ERRONEOUS:
					throw unexpectedQuote(result);
				case SUPERFLUOUS:
					superfluous(result.getNode());
					break;
				default:
					if (result.getNode().getKind().equals("\"")) {
						return new StringContent("", NodeMovement.CURRENT);
					}
					return new StringContent(text(result), NodeMovement.NEXT_SIBLING);
			}
		}
	}

	private HtmlAttributeValueContent parseHtmlStringContent(AttributeKey key, DocumentParser documentParser)
			throws UnparsableException, SpmlParseException {
		while (true) {
			NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
					throw new UnparsableException(
							"\"" + key.getValue() + "\" html attribute value string is unclosed",
							TreeWalker.span(parent));
				case MISSING:
					throw new UnparsableException(
							"\"" + key.getValue() + "\" html attribute value string has no content",
							TreeWalker.span(parent));
				case ERRONEOUS:
					throw unexpectedQuote(result);
				case SUPERFLUOUS:
					superfluous(result.getNode());
					break;
				default:
					if (result.getNode().getKind().equals("\"")) {
						return new HtmlAttributeValueContent.Empty();
					}
					return documentParser.parseHtmlAttributeValueContent();
			}
		}
	}

	private SingleLineSpan parseClosingQuote(AttributeKey key, NodeMovement movement) throws UnparsableException {
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException(
							"\"" + key.getValue() + "\" closing attribute value string is unclosed",
							TreeWalker.span(parent));
				case ERRONEOUS:
					throw unexpectedQuote(result);
				case SUPERFLUOUS:
					superfluous(result.getNode());
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					return singleLine(result.getNode(), "\"\"\" should be on a single line");
			}
		}
	}

	private UnparsableException unexpectedQuote(NodeMovingResult result) {
		return new UnparsableException(
				"expected \"\"\", found \"" + text(result) + "\"", TreeWalker.span(result.getNode()));
	}

	private SingleLineSpan singleLine(SyntaxNode node, String message) throws UnparsableException {
		Span span = TreeWalker.span(node);
		if (!(span instanceof SingleLineSpan)) {
			throw new UnparsableException(message, span);
		}
		return (SingleLineSpan) span;
	}

	private void superfluous(SyntaxNode node) {
		issues.add(ParseIssue.superfluous(walker.text(node), TreeWalker.span(node)));
	}

	private String text(NodeMovingResult result) {
		return walker.text(result.getNode());
	}

	private static final class StringContent {
		private final String text;
		private final NodeMovement next;

		private StringContent(String text, NodeMovement next) {
			this.text = text;
			this.next = next;
		}
	}
}
