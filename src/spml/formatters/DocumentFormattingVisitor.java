package spml.formatters;

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
import spml.model.document.PlainAttribute;
import spml.model.document.Tag;
import spml.model.document.TagBody;
import spml.model.document.TagLibImport;
import spml.model.document.TagNode;
import spml.model.document.TextNode;
import spml.model.spel.SpelAst;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;
import java.util.Optional;

/**
 * Dumps a {@link Document} as an indented outline, one construct per line.
 *
 * <pre>
 * taglib prefix="sp"
 * tag sp:if
 *   test = condition: _a == 'b'
 *   text "hello"
 * </pre>
 */
public class DocumentFormattingVisitor extends NodeVisitor<Void, IOException> {
	private final IndentingWriter out;
	private boolean firstLine = true;

	public DocumentFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	public static String format(Document document) {
		StringWriter w = new StringWriter();
		try {
			new DocumentFormattingVisitor(new IndentingWriter(w)).visit(document);
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	public void visit(Document document) throws IOException {
		for (Parsed<PageHeader> parsed : document.getHeader().getPageHeaders()) {
			line("page");
			if (state(parsed)) {
				PageHeader header = parsed.getValue().get();
				writePlain("contentType", header.getContentType());
				writePlain("language", header.getLanguage());
				writePlain("pageEncoding", header.getPageEncoding());
				for (Parsed<PlainAttribute> anImport : header.getImports()) {
					writePlain("import", Optional.of(anImport));
				}
			}
		}
		for (Parsed<TagLibImport> parsed : document.getHeader().getTagLibImports()) {
			line("taglib");
			if (state(parsed)) {
				TagLibImport tagLib = parsed.getValue().get();
				if (tagLib.getOrigin().isPresent()) {
					Parsed<PlainAttribute> origin = tagLib.getOrigin().get().getAttribute();
					String key = origin.getValue().map(a -> a.getKey().getValue()).orElse("origin");
					writePlain(key, Optional.of(origin));
				}
				writePlain("prefix", tagLib.getPrefix());
			}
		}
		for (Node node : document.getNodes()) {
			node.accept(this);
		}
	}

	@Override
	public Void visit(TagNode tagNode) throws IOException {
		line("tag");
		Parsed<Tag> parsed = tagNode.getTag();
		if (parsed.getValue().isPresent()) {
			out.write(" ");
			out.write(parsed.getValue().get().getName());
		}
		if (state(parsed)) {
			writeTag(parsed.getValue().get());
		}
		return null;
	}

	private void writeTag(Tag tag) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Map.Entry<String, Parsed<ExpressionAttribute>> entry : tag.getAttributes().entrySet()) {
				line(entry.getKey());
				out.write(" =");
				if (state(entry.getValue())) {
					SpelAst spel = entry.getValue().getValue().get().getValue().getSpel();
					out.write(" ");
					out.write(spel.getGrammar().name().toLowerCase());
					out.write(": ");
					if (spel.getResult().getRoot().isPresent()) {
						spel.getResult().getRoot().get().accept(new SpelFormattingVisitor(out));
					} else {
						out.write("invalid (");
						out.write(spel.getResult().getError().get().getMessage());
						out.write(")");
					}
				}
			}
			if (tag.getBody().isPresent()) {
				writeBody(tag.getBody().get());
			}
		}
	}

	@Override
	public Void visit(HtmlNode htmlNode) throws IOException {
		line("html");
		Parsed<HtmlElement> parsed = htmlNode.getElement();
		if (parsed.getValue().isPresent()) {
			out.write(" ");
			out.write(parsed.getValue().get().getName());
		}
		if (!state(parsed)) {
			return null;
		}
		HtmlElement element = parsed.getValue().get();
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Parsed<HtmlAttribute> attribute : element.getAttributes()) {
				line("attribute");
				if (state(attribute)) {
					writeHtmlAttribute(attribute.getValue().get());
				}
			}
			if (element.getBody().isPresent()) {
				writeBody(element.getBody().get());
			}
		}
		return null;
	}

	private void writeHtmlAttribute(HtmlAttribute attribute) throws IOException {
		out.write(" ");
		out.write(attribute.getKey().getValue());
		if (!attribute.getValue().isPresent()) {
			return;
		}
		out.write(" =");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (HtmlAttributeValueFragment fragment : attribute.getValue().get().getContent().getFragments()) {
				if (fragment instanceof HtmlAttributeValueFragment.Plain) {
					line("text ");
					quote(((HtmlAttributeValueFragment.Plain) fragment).getText());
				} else {
					new TagNode(((HtmlAttributeValueFragment.TagFragment) fragment).getTag()).accept(this);
				}
			}
		}
	}

	private void writeBody(TagBody body) throws IOException {
		for (Node node : body.getNodes()) {
			node.accept(this);
		}
	}

	@Override
	public Void visit(TextNode textNode) throws IOException {
		line("text ");
		quote(textNode.getContent());
		return null;
	}

	@Override
	public Void visit(ErrorNode errorNode) throws IOException {
		line("error ");
		quote(errorNode.getContent());
		return null;
	}

	private void writePlain(String name, Optional<Parsed<PlainAttribute>> attribute) throws IOException {
		if (!attribute.isPresent()) {
			return;
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			line(name);
			out.write(" =");
			if (state(attribute.get())) {
				out.write(" ");
				quote(attribute.get().getValue().get().getValue().getContent());
			}
		}
	}

	/**
	 * Writes how the construct was parsed unless it is valid.
	 *
	 * @return whether there is a value to write
	 */
	private boolean state(Parsed<?> parsed) throws IOException {
		if (parsed.isUnparsable()) {
			out.write(" unparsable (");
			out.write(((Parsed.Unparsable<?>) parsed).getMessage());
			out.write(")");
			return false;
		}
		if (!parsed.isValid()) {
			out.write(" erroneous (");
			out.write(Integer.toString(parsed.getIssues().size()));
			out.write(" issue(s))");
		}
		return true;
	}

	private void quote(String text) throws IOException {
		out.write('"');
		out.write(text.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\""));
		out.write('"');
	}

	private void line(String text) throws IOException {
		if (firstLine) {
			firstLine = false;
		} else {
			out.newLine();
		}
		out.write(text);
	}
}
