package spml.parser;

import spml.cst.NodeMovement;
import spml.cst.NodeMovingResult;
import spml.cst.SpmlTreeBuilder;
import spml.cst.SyntaxNode;
import spml.cst.SyntaxTree;
import spml.cst.TreeCursor;
import spml.cst.TreeWalker;
import spml.errors.ParseIssue;
import spml.model.document.Document;
import spml.model.document.ErrorNode;
import spml.model.document.ExpressionAttribute;
import spml.model.document.Header;
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
import spml.model.document.TagBody;
import spml.model.document.TagLibImport;
import spml.model.document.TagLibOrigin;
import spml.model.document.TagNode;
import spml.model.document.TextNode;
import spml.model.schema.TagAttributeDefinition;
import spml.model.schema.TagDefinition;
import spml.model.schema.TagSchema;
import spml.util.Position;
import spml.util.Range;
import spml.util.SingleLineSpan;
import spml.util.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turns a concrete syntax tree into a {@link Document}.
 *
 * Every construct is parsed with local recovery: problems are attached to the innermost construct as
 * {@link ParseIssue}s, and a construct that cannot be built at all becomes {@link Parsed.Unparsable} without
 * affecting its siblings. Only a tree that is not shaped like a document at all makes the parse fail.
 */
public class DocumentParser {
	private static final Logger logger = Logger.getLogger(DocumentParser.class.getName());

	private static final String ATTRIBUTE_SUFFIX = "_attribute";
	private static final String CLOSE_SUFFIX = "_tag_close";

	private enum HtmlForm {
		REGULAR,
		VOID,
		OPTIONAL_BODY,
	}

	private final SyntaxTree tree;
	private final TreeWalker walker;
	private final TagSchema schema;

	private DocumentParser(SyntaxTree tree, TagSchema schema) {
		this.tree = tree;
		this.walker = new TreeWalker(tree);
		this.schema = schema;
	}

	public static Document parse(SyntaxTree tree, TagSchema schema) throws SpmlParseException {
		return new DocumentParser(tree, schema).parseDocument();
	}

	public static Document parse(String text, TagSchema schema) throws SpmlParseException {
		return parse(new SpmlTreeBuilder(schema).build(text), schema);
	}

	private Document parseDocument() throws SpmlParseException {
		String rootKind = walker.node().getKind();
		if (!rootKind.equals("document") && !rootKind.equals("ERROR")) {
			throw new SpmlParseException("missplaced cursor, expected a document but found \"" + rootKind + "\"");
		}
		if (!walker.gotoFirstChild()) {
			throw new SpmlParseException("document is empty");
		}
		List<Parsed<PageHeader>> pageHeaders = new ArrayList<>();
		List<Parsed<TagLibImport>> tagLibImports = new ArrayList<>();
		boolean exhausted = false;
		headers:
		while (true) {
			switch (walker.node().getKind()) {
				case "page_header":
					pageHeaders.add(parsePageHeader());
					break;
				case "taglib_header":
					tagLibImports.add(parseTagLibHeader());
					break;
				case "comment":
				case "xml_comment":
					break;
				default:
					break headers;
			}
			if (!walker.gotoNextSibling()) {
				exhausted = true;
				break;
			}
		}
		List<Node> nodes = exhausted ? Collections.emptyList() : parseNodes();
		return new Document(new Header(pageHeaders, tagLibImports), nodes);
	}

	private Parsed<PageHeader> parsePageHeader() {
		SyntaxNode parent = walker.node();
		List<ParseIssue> issues = new ArrayList<>();
		try (TreeCursor.Mark ignored = walker.mark()) {
			SingleLineSpan open = parseHeaderOpen(parent, "page", issues);
			SingleLineSpan keyword = parseHeaderKeyword("page", issues);
			Parsed<PlainAttribute> contentType = null;
			Parsed<PlainAttribute> language = null;
			Parsed<PlainAttribute> pageEncoding = null;
			List<Parsed<PlainAttribute>> imports = new ArrayList<>();
			SingleLineSpan close = null;
			while (close == null) {
				NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
				if (result.getOutcome() != NodeMovingResult.Outcome.OK) {
					close = headerDeviation(result, parent, "page", issues);
					continue;
				}
				switch (result.getNode().getKind()) {
					case "contentType_attribute":
						contentType = AttributeParser.plain(walker);
						break;
					case "language_attribute":
						language = AttributeParser.plain(walker);
						break;
					case "pageEncoding_attribute":
						pageEncoding = AttributeParser.plain(walker);
						break;
					case "import_attribute":
						imports.add(AttributeParser.plain(walker));
						break;
					case "header_close":
						close = singleLine(result.getNode(), "\"%>\" should be on a single line");
						break;
					default:
						issues.add(superfluous(result.getNode()));
				}
			}
			PageHeader header = new PageHeader(open, keyword, contentType, language, pageEncoding, imports, close);
			return Parsed.of(header, issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private Parsed<TagLibImport> parseTagLibHeader() {
		SyntaxNode parent = walker.node();
		List<ParseIssue> issues = new ArrayList<>();
		try (TreeCursor.Mark ignored = walker.mark()) {
			SingleLineSpan open = parseHeaderOpen(parent, "taglib", issues);
			SingleLineSpan keyword = parseHeaderKeyword("taglib", issues);
			TagLibOrigin origin = null;
			Parsed<PlainAttribute> prefix = null;
			SingleLineSpan close = null;
			while (close == null) {
				NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
				if (result.getOutcome() != NodeMovingResult.Outcome.OK) {
					close = headerDeviation(result, parent, "taglib", issues);
					continue;
				}
				switch (result.getNode().getKind()) {
					case "uri_attribute":
						origin = new TagLibOrigin.Uri(AttributeParser.plain(walker));
						break;
					case "tagdir_attribute":
						origin = new TagLibOrigin.TagDir(AttributeParser.plain(walker));
						break;
					case "prefix_attribute":
						prefix = AttributeParser.plain(walker);
						break;
					case "header_close":
						close = singleLine(result.getNode(), "\"%>\" should be on a single line");
						break;
					default:
						issues.add(superfluous(result.getNode()));
				}
			}
			return Parsed.of(new TagLibImport(open, keyword, origin, prefix, close), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private SingleLineSpan parseHeaderOpen(SyntaxNode parent, String keyword, List<ParseIssue> issues)
			throws UnparsableException {
		NodeMovement movement = NodeMovement.FIRST_CHILD;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException("missing " + keyword + " header", TreeWalker.span(parent));
				case ERRONEOUS:
					throw invalidHeader(result.getNode(), keyword);
				case SUPERFLUOUS:
					issues.add(superfluous(result.getNode()));
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					return singleLine(result.getNode(), "\"<%@\" should be on a single line");
			}
		}
	}

	private SingleLineSpan parseHeaderKeyword(String keyword, List<ParseIssue> issues) throws UnparsableException {
		SyntaxNode parent = walker.node().getParent();
		while (true) {
			NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
					throw new UnparsableException(keyword + " header is unclosed", TreeWalker.span(parent));
				case MISSING:
					SingleLineSpan span = singleLine(result.getNode(), "\"" + keyword + "\" should be on a single line");
					issues.add(ParseIssue.missing(keyword, span));
					return span;
				case ERRONEOUS:
					throw invalidHeader(result.getNode(), keyword);
				case SUPERFLUOUS:
					issues.add(superfluous(result.getNode()));
					break;
				default:
					return singleLine(result.getNode(), "\"" + keyword + "\" should be on a single line");
			}
		}
	}

	/**
	 * Handles a header child that is not plainly there.
	 *
	 * @return the span of "%&gt;" if the deviation was a missing one, null if the header continues
	 */
	private SingleLineSpan headerDeviation(NodeMovingResult result, SyntaxNode parent, String keyword,
	                                       List<ParseIssue> issues) throws UnparsableException {
		switch (result.getOutcome()) {
			case NON_EXISTENT:
				throw new UnparsableException("unclosed " + keyword + " header", TreeWalker.span(parent));
			case MISSING:
				SyntaxNode node = result.getNode();
				if (node.getKind().equals("header_close")) {
					SingleLineSpan span = singleLine(node, "\"%>\" should be on a single line");
					issues.add(ParseIssue.missing("%>", span));
					return span;
				}
				issues.add(ParseIssue.missing(node.getKind(), TreeWalker.span(node)));
				return null;
			case ERRONEOUS:
				throw invalidHeader(result.getNode(), keyword);
			default:
				issues.add(superfluous(result.getNode()));
				return null;
		}
	}

	private UnparsableException invalidHeader(SyntaxNode node, String keyword) {
		return new UnparsableException(
				"invalid " + keyword + " header \"" + walker.text(node) + "\"", TreeWalker.span(node));
	}

	/**
	 * Parses the node under the cursor and its following siblings, until the closing tag of the enclosing
	 * element or the end of the siblings. The cursor is left on the node that ended the loop.
	 */
	private List<Node> parseNodes() throws SpmlParseException {
		List<Node> nodes = new ArrayList<>();
		while (true) {
			SyntaxNode node = walker.node();
			String kind = node.getKind();
			switch (kind) {
				case "comment":
				case "xml_comment":
				case "html_doctype":
				case "java_tag":
				case "page_header":
				case "taglib_header":
					break;
				case "text":
				case "xml_entity":
					nodes.add(parseText());
					if (isText(walker.node())) {
						// the text ran up to the last sibling
						return nodes;
					}
					continue;
				case "ERROR":
					nodes.add(new ErrorNode(walker.text(node), range(node)));
					break;
				case "html_tag":
				case "script_tag":
				case "style_tag":
					nodes.add(new HtmlNode(parseHtml(HtmlForm.REGULAR)));
					break;
				case "html_option_tag":
					nodes.add(new HtmlNode(parseHtml(HtmlForm.OPTIONAL_BODY)));
					break;
				case "html_void_tag":
					nodes.add(new HtmlNode(parseHtml(HtmlForm.VOID)));
					break;
				default:
					if (kind.endsWith(CLOSE_SUFFIX)) {
						return nodes;
					}
					Optional<TagDefinition> definition = schema.byKind(kind);
					if (definition.isPresent()) {
						nodes.add(new TagNode(parseTag(definition.get())));
					} else {
						logger.fine("skipping unknown node kind \"" + kind + "\" at " + node.getStartPosition());
					}
			}
			if (!walker.gotoNextSibling()) {
				return nodes;
			}
		}
	}

	private static boolean isText(SyntaxNode node) {
		return node.getKind().equals("text") || node.getKind().equals("xml_entity");
	}

	/**
	 * Merges the text and entity nodes starting at the cursor into one text node. The cursor is left on the first
	 * node after them, or on the last of them if they end the siblings.
	 */
	private TextNode parseText() {
		SyntaxNode first = walker.node();
		SyntaxNode last = first;
		while (walker.gotoNextSibling()) {
			if (!isText(walker.node())) {
				break;
			}
			last = walker.node();
		}
		String content = tree.getText().substring(first.getStartOffset(), last.getEndOffset());
		return new TextNode(content, new Range(first.getStartPosition(), last.getEndPosition()));
	}

	private Parsed<Tag> parseTag(TagDefinition definition) throws SpmlParseException {
		SyntaxNode parent = walker.node();
		String name = definition.getName();
		List<ParseIssue> issues = new ArrayList<>();
		try (TreeCursor.Mark ignored = walker.mark()) {
			SingleLineSpan open = parseOpen(parent, issues);
			Map<String, Parsed<ExpressionAttribute>> attributes = new LinkedHashMap<>();
			TagBody body = null;
			SingleLineSpan close = null;
			while (close == null) {
				NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
				switch (result.getOutcome()) {
					case NON_EXISTENT:
						throw new UnparsableException("\"" + name + "\" tag is unclosed", TreeWalker.span(parent));
					case MISSING: {
						SyntaxNode node = result.getNode();
						if (node.getKind().equals(">")) {
							body = parseRequiredBody(node, "\"" + name + "\" tag is unclosed");
							close = parseClosingTag(name, parent, issues);
						} else if (node.getKind().equals("self_closing_tag_end")) {
							issues.add(ParseIssue.missing("/>", TreeWalker.span(node)));
							close = moveMissingNodePastWhitespaces(node);
						} else {
							throw new UnparsableException(
									"\"" + node.getKind() + "\" is missing in \"" + name + "\" tag",
									TreeWalker.span(parent));
						}
						break;
					}
					case ERRONEOUS:
						throw new UnparsableException(
								walker.text(result.getNode()), TreeWalker.span(result.getNode()));
					case SUPERFLUOUS:
						issues.add(superfluous(result.getNode()));
						break;
					default: {
						SyntaxNode node = result.getNode();
						String kind = node.getKind();
						if (kind.endsWith(ATTRIBUTE_SUFFIX)) {
							String attribute = kind.substring(0, kind.length() - ATTRIBUTE_SUFFIX.length());
							Optional<TagAttributeDefinition> attributeDefinition = definition.getAttribute(attribute);
							if (attributeDefinition.isPresent() && !attributes.containsKey(attribute)) {
								attributes.put(attribute,
										AttributeParser.expression(walker, attributeDefinition.get().getType()));
							} else {
								// repeated, or not declared for this tag
								issues.add(superfluous(node));
							}
						} else if (kind.equals("self_closing_tag_end")) {
							close = singleLine(node, "\"/>\" should be on a single line");
						} else if (kind.equals(">")) {
							body = parseRequiredBody(node, "\"" + name + "\" tag is unclosed");
							close = parseClosingTag(name, parent, issues);
						}
					}
				}
			}
			return Parsed.of(new Tag(definition, open, attributes, body, close), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private Parsed<HtmlElement> parseHtml(HtmlForm form) throws SpmlParseException {
		SyntaxNode parent = walker.node();
		List<ParseIssue> issues = new ArrayList<>();
		try (TreeCursor.Mark ignored = walker.mark()) {
			SingleLineSpan open = parseHtmlOpen(parent, issues);
			String name = walker.text(walker.node()).substring(1);
			List<Parsed<HtmlAttribute>> attributes = new ArrayList<>();
			TagBody body = null;
			SingleLineSpan close = null;
			while (close == null) {
				NodeMovingResult result = walker.move(NodeMovement.NEXT_SIBLING);
				SyntaxNode node;
				switch (result.getOutcome()) {
					case NON_EXISTENT:
						throw new UnparsableException("html tag is unclosed", TreeWalker.span(parent));
					case MISSING:
						node = result.getNode();
						if (node.getKind().equals("self_closing_tag_end")) {
							issues.add(ParseIssue.missing("/>", TreeWalker.span(node)));
							close = moveMissingNodePastWhitespaces(node);
						} else {
							issues.add(ParseIssue.missing(node.getKind(), TreeWalker.span(node)));
						}
						break;
					case ERRONEOUS:
						throw new UnparsableException(
								"invalid html \"" + walker.text(result.getNode()) + "\"",
								TreeWalker.span(result.getNode()));
					case SUPERFLUOUS:
						issues.add(superfluous(result.getNode()));
						break;
					default:
						node = result.getNode();
						switch (node.getKind()) {
							case "dynamic_attribute":
								attributes.add(AttributeParser.html(walker, this));
								break;
							case "self_closing_tag_end":
								close = singleLine(node, "\"/>\" should be on a single line");
								break;
							case ">":
								SingleLineSpan greaterThan = singleLine(node, "\">\" should be on a single line");
								switch (form) {
									case VOID:
										close = greaterThan;
										break;
									case OPTIONAL_BODY:
										body = parseTagBody(node).orElse(null);
										close = body == null ? greaterThan : parseClosingTag(name, parent, issues);
										break;
									default:
										body = parseRequiredBody(node, "html tag \"" + name + "\" is unclosed");
										close = parseClosingTag(name, parent, issues);
								}
								break;
							default:
								logger.fine("skipping \"" + node.getKind() + "\" in html tag \"" + name + "\"");
						}
				}
			}
			return Parsed.of(new HtmlElement(name, open, attributes, body, close), issues);
		} catch (UnparsableException e) {
			return e.toParsed();
		}
	}

	private SingleLineSpan parseOpen(SyntaxNode parent, List<ParseIssue> issues)
			throws UnparsableException, SpmlParseException {
		NodeMovement movement = NodeMovement.FIRST_CHILD;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new SpmlParseException("tag is empty at " + parent.getStartPosition());
				case ERRONEOUS:
					throw new UnparsableException(walker.text(result.getNode()), TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					issues.add(superfluous(result.getNode()));
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					String text = walker.text(result.getNode());
					return singleLine(result.getNode(), "\"" + text + "\" should be on a single line");
			}
		}
	}

	private SingleLineSpan parseHtmlOpen(SyntaxNode parent, List<ParseIssue> issues) throws UnparsableException {
		NodeMovement movement = NodeMovement.FIRST_CHILD;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
				case MISSING:
					throw new UnparsableException("missing html", TreeWalker.span(parent));
				case ERRONEOUS:
					throw new UnparsableException(
							"invalid html \"" + walker.text(result.getNode()) + "\"",
							TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					issues.add(superfluous(result.getNode()));
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					String text = walker.text(result.getNode());
					return singleLine(result.getNode(), "\"" + text + "\" should be on a single line");
			}
		}
	}

	private TagBody parseRequiredBody(SyntaxNode greaterThan, String unclosed)
			throws UnparsableException, SpmlParseException {
		Optional<TagBody> body = parseTagBody(greaterThan);
		if (!body.isPresent()) {
			throw new UnparsableException(unclosed, TreeWalker.span(greaterThan));
		}
		return body.get();
	}

	/**
	 * Parses the nodes after the "&gt;" under the cursor.
	 *
	 * @return nothing if the "&gt;" is the last child of its element
	 */
	private Optional<TagBody> parseTagBody(SyntaxNode greaterThan) throws UnparsableException, SpmlParseException {
		SingleLineSpan open = singleLine(greaterThan, "\">\" should be on a single line");
		if (!walker.gotoNextSibling()) {
			return Optional.empty();
		}
		return Optional.of(new TagBody(open, parseNodes()));
	}

	/**
	 * Parses the closing tag the body parse stopped at.
	 */
	private SingleLineSpan parseClosingTag(String name, SyntaxNode parent, List<ParseIssue> issues)
			throws UnparsableException {
		NodeMovement movement = NodeMovement.CURRENT;
		while (true) {
			NodeMovingResult result = walker.move(movement);
			switch (result.getOutcome()) {
				case NON_EXISTENT:
					throw new UnparsableException("\"" + name + "\" tag is unclosed", TreeWalker.span(parent));
				case MISSING:
					SingleLineSpan moved = moveMissingNodePastWhitespaces(result.getNode());
					issues.add(ParseIssue.missing("</" + name + ">", moved));
					return moved;
				case ERRONEOUS:
					throw new UnparsableException(walker.text(result.getNode()), TreeWalker.span(result.getNode()));
				case SUPERFLUOUS:
					issues.add(superfluous(result.getNode()));
					movement = NodeMovement.NEXT_SIBLING;
					break;
				default:
					SyntaxNode node = result.getNode();
					String text = walker.text(node);
					if (!node.getKind().endsWith(CLOSE_SUFFIX)) {
						throw new UnparsableException(text, TreeWalker.span(node));
					}
					return singleLine(node, "\"" + text + "\" should be on a single line");
			}
		}
	}

	/**
	 * Parses the content of a quoted html attribute value, starting at the cursor and ending on the closing quote.
	 */
	HtmlAttributeValueContent parseHtmlAttributeValueContent() throws SpmlParseException {
		List<HtmlAttributeValueFragment> fragments = new ArrayList<>();
		while (true) {
			SyntaxNode node = walker.node();
			String kind = node.getKind();
			if (kind.equals("\"")) {
				break;
			}
			if (kind.equals("string_content")) {
				fragments.add(new HtmlAttributeValueFragment.Plain(walker.text(node)));
			} else {
				Optional<TagDefinition> definition = schema.byKind(kind);
				if (definition.isPresent()) {
					fragments.add(new HtmlAttributeValueFragment.TagFragment(parseTag(definition.get())));
				} else {
					logger.fine("skipping \"" + kind + "\" in html attribute value at " + node.getStartPosition());
				}
			}
			if (!walker.gotoNextSibling()) {
				break;
			}
		}
		return HtmlAttributeValueContent.of(fragments);
	}

	/**
	 * Missing nodes sit directly behind the last token that is present. Issues read better at the place where the
	 * absent text would be typed, which is where the next node starts, or the end of the document.
	 */
	private SingleLineSpan moveMissingNodePastWhitespaces(SyntaxNode node) {
		Optional<SyntaxNode> next = findNextNode(node);
		if (next.isPresent()) {
			return (SingleLineSpan) Span.at(next.get().getStartPosition());
		}
		String trailing = tree.getText().substring(node.getEndOffset());
		if (trailing.endsWith("\r\n")) {
			trailing = trailing.substring(0, trailing.length() - 2);
		} else if (trailing.endsWith("\n")) {
			trailing = trailing.substring(0, trailing.length() - 1);
		}
		Position position = tree.getLineIndex().positionOf(node.getEndOffset() + trailing.length());
		return (SingleLineSpan) Span.at(position);
	}

	private static Optional<SyntaxNode> findNextNode(SyntaxNode node) {
		SyntaxNode current = node;
		while (current != null) {
			Optional<SyntaxNode> sibling = current.nextSibling();
			while (sibling.isPresent() && sibling.get().isMissing()) {
				sibling = sibling.get().nextSibling();
			}
			if (sibling.isPresent()) {
				return sibling;
			}
			current = current.getParent();
		}
		return Optional.empty();
	}

	private SingleLineSpan singleLine(SyntaxNode node, String message) throws UnparsableException {
		Span span = TreeWalker.span(node);
		if (!(span instanceof SingleLineSpan)) {
			throw new UnparsableException(message, span);
		}
		return (SingleLineSpan) span;
	}

	private ParseIssue superfluous(SyntaxNode node) {
		return ParseIssue.superfluous(walker.text(node), TreeWalker.span(node));
	}

	private static Range range(SyntaxNode node) {
		return new Range(node.getStartPosition(), node.getEndPosition());
	}
}
