package spml;

import spml.errors.ErrorNodeIssue;
import spml.errors.IssueContext;
import spml.errors.SpelSyntaxIssue;
import spml.errors.StructuralIssue;
import spml.errors.UnparsableIssue;
import spml.model.document.Document;
import spml.model.document.ErrorNode;
import spml.model.document.ExpressionAttribute;
import spml.model.document.HtmlAttribute;
import spml.model.document.HtmlAttributeValueFragment;
import spml.model.document.HtmlElement;
import spml.model.document.HtmlNode;
import spml.model.document.Node;
import spml.model.document.NodeVisitor;
import spml.model.document.PageHeader;
import spml.model.document.Parsed;
import spml.model.document.Tag;
import spml.model.document.TagBody;
import spml.model.document.TagLibImport;
import spml.model.document.TagNode;
import spml.model.document.TextNode;
import spml.model.spel.SpelSyntaxError;
import spml.model.spel.SpelSyntaxFix;
import spml.util.Range;
import spml.util.Span;

import java.util.Map;

/**
 * Reports every structural finding of a parsed document: tolerated issues, constructs that could not be parsed,
 * error nodes and, optionally, expression-language syntax errors.
 */
public class DocumentIssueCollector extends NodeVisitor<Void, RuntimeException> {
	private final IssueContext ctx;
	private final boolean includeSyntaxErrors;

	public DocumentIssueCollector(IssueContext ctx, boolean includeSyntaxErrors) {
		this.ctx = ctx;
		this.includeSyntaxErrors = includeSyntaxErrors;
	}

	public static void collect(IssueContext ctx, Document document, boolean includeSyntaxErrors) {
		DocumentIssueCollector collector = new DocumentIssueCollector(ctx, includeSyntaxErrors);
		for (Parsed<PageHeader> header : document.getHeader().getPageHeaders()) {
			if (collector.report(header)) {
				PageHeader value = header.getValue().get();
				value.getContentType().ifPresent(collector::report);
				value.getLanguage().ifPresent(collector::report);
				value.getPageEncoding().ifPresent(collector::report);
				value.getImports().forEach(collector::report);
			}
		}
		for (Parsed<TagLibImport> tagLib : document.getHeader().getTagLibImports()) {
			if (collector.report(tagLib)) {
				TagLibImport value = tagLib.getValue().get();
				value.getOrigin().ifPresent(origin -> collector.report(origin.getAttribute()));
				value.getPrefix().ifPresent(collector::report);
			}
		}
		for (Node node : document.getNodes()) {
			node.accept(collector);
		}
	}

	/**
	 * @return whether the construct has a value to descend into
	 */
	private boolean report(Parsed<?> parsed) {
		if (parsed.isUnparsable()) {
			Parsed.Unparsable<?> unparsable = (Parsed.Unparsable<?>) parsed;
			ctx.error(new UnparsableIssue(unparsable.getMessage(), unparsable.getSpan()));
			return false;
		}
		parsed.getIssues().forEach(issue -> ctx.error(new StructuralIssue(issue)));
		return true;
	}

	@Override
	public Void visit(TagNode tagNode) {
		reportTag(tagNode.getTag());
		return null;
	}

	private void reportTag(Parsed<Tag> parsed) {
		if (!report(parsed)) {
			return;
		}
		Tag tag = parsed.getValue().get();
		for (Map.Entry<String, Parsed<ExpressionAttribute>> entry : tag.getAttributes().entrySet()) {
			if (report(entry.getValue()) && includeSyntaxErrors) {
				ExpressionAttribute.Value value = entry.getValue().getValue().get().getValue();
				value.getSpel().getResult().getError().ifPresent(error ->
						ctx.error(new SpelSyntaxIssue(entry.getKey(), error, errorSpan(error, value))));
			}
		}
		tag.getBody().ifPresent(this::reportBody);
	}

	/**
	 * Syntax errors carry no location of their own; the first proposed fix points at the problem when there is
	 * one, otherwise the whole attribute value is reported.
	 */
	private static Span errorSpan(SpelSyntaxError error, ExpressionAttribute.Value value) {
		if (!error.getProposedFixes().isEmpty()) {
			SpelSyntaxFix fix = error.getProposedFixes().get(0);
			Range range = fix.getRange(value.getSpelSource());
			return Span.between(range.getStart(), range.getEnd());
		}
		return Span.between(value.getOpeningQuote().start(), value.getClosingQuote().end());
	}

	@Override
	public Void visit(HtmlNode htmlNode) {
		Parsed<HtmlElement> parsed = htmlNode.getElement();
		if (!report(parsed)) {
			return null;
		}
		HtmlElement element = parsed.getValue().get();
		for (Parsed<HtmlAttribute> attribute : element.getAttributes()) {
			if (report(attribute)) {
				attribute.getValue().get().getValue().ifPresent(value -> {
					for (HtmlAttributeValueFragment fragment : value.getContent().getFragments()) {
						if (fragment instanceof HtmlAttributeValueFragment.TagFragment) {
							reportTag(((HtmlAttributeValueFragment.TagFragment) fragment).getTag());
						}
					}
				});
			}
		}
		element.getBody().ifPresent(this::reportBody);
		return null;
	}

	private void reportBody(TagBody body) {
		for (Node node : body.getNodes()) {
			node.accept(this);
		}
	}

	@Override
	public Void visit(TextNode textNode) {
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) {
		ctx.error(new ErrorNodeIssue(errorNode));
		return null;
	}
}
