package spml.formatters;

import spml.errors.DocumentParseIssue;
import spml.errors.ErrorNodeIssue;
import spml.errors.IOErrorIssue;
import spml.errors.IssueVisitor;
import spml.errors.IssueWithContext;
import spml.errors.ParseIssue;
import spml.errors.ParseIssueVisitor;
import spml.errors.SpelSyntaxIssue;
import spml.errors.StructuralIssue;
import spml.errors.UnparsableIssue;
import spml.util.Position;
import spml.util.Span;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private static final int MAX_QUOTED_LENGTH = 40;

	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(StructuralIssue structuralIssue) throws IOException {
		ParseIssue parseIssue = structuralIssue.getParseIssue();
		parseIssue.accept(new ParseIssueVisitor<Void, IOException>() {
			@Override
			public Void visit(ParseIssue.Superfluous superfluous) throws IOException {
				out.write("superfluous ");
				return null;
			}

			@Override
			public Void visit(ParseIssue.Missing missing) throws IOException {
				out.write("missing ");
				return null;
			}
		});
		quote(parseIssue.getText());
		location(parseIssue.getSpan());
		return null;
	}

	@Override
	public Void visit(UnparsableIssue unparsableIssue) throws IOException {
		out.write("unparsable: ");
		out.write(unparsableIssue.getReason());
		location(unparsableIssue.getSpan().get());
		return null;
	}

	@Override
	public Void visit(ErrorNodeIssue errorNodeIssue) throws IOException {
		out.write("unexpected ");
		quote(errorNodeIssue.getNode().getContent());
		location(errorNodeIssue.getSpan().get());
		return null;
	}

	@Override
	public Void visit(SpelSyntaxIssue spelSyntaxIssue) throws IOException {
		out.write("invalid value of attribute ");
		quote(spelSyntaxIssue.getAttribute());
		out.write(": ");
		out.write(spelSyntaxIssue.getError().getMessage());
		location(spelSyntaxIssue.getSpan().get());
		return null;
	}

	@Override
	public Void visit(DocumentParseIssue documentParseIssue) throws IOException {
		out.write("unable to parse document: ");
		out.write(documentParseIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	private void quote(String text) throws IOException {
		int lineBreak = text.indexOf('\n');
		String shown = lineBreak < 0 ? text : text.substring(0, lineBreak);
		if (shown.length() > MAX_QUOTED_LENGTH) {
			shown = shown.substring(0, MAX_QUOTED_LENGTH);
		}
		out.write('"');
		out.write(shown);
		if (shown.length() < text.length()) {
			out.write("...");
		}
		out.write('"');
	}

	private void location(Span span) throws IOException {
		Position start = span.start();
		out.write(" at line ");
		out.write(Integer.toString(start.getLine() + 1));
		out.write(" column ");
		out.write(Integer.toString(start.getCharacter() + 1));
	}
}
