package spml.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;

import org.junit.Test;

import spml.model.document.ErrorNode;
import spml.model.spel.SpelSyntaxError;
import spml.parser.SpmlParseException;
import spml.util.Position;
import spml.util.Range;
import spml.util.SingleLineSpan;

public class TopLevelIssueContextTest {

	@Test
	public void issuesAreWrappedInTheirContext() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertFalse(ctx.hasErrors());
		IssueContext inFile = ctx.withContext(new InFile("a.spml"));
		inFile.error(new StructuralIssue(ParseIssue.missing("</sp:if>", new SingleLineSpan(1, 7, 0))));
		assertTrue(inFile.hasErrors());
		assertThat(ctx.getIssues().size(), is(1));
		Issue issue = ctx.getIssues().get(0);
		assertThat(issue, instanceOf(IssueWithContext.class));
		assertThat(((IssueWithContext) issue).getContext(), is((Context) new InFile("a.spml")));
		assertThat(issue.getSpan().get(), is(new SingleLineSpan(1, 7, 0)));
		assertThat(ctx.format(), is("Detected 1 issue(s):\n"
				+ "in file a.spml\n"
				+ "  missing \"</sp:if>\" at line 2 column 8"));
	}

	@Test
	public void messages() {
		assertThat(new StructuralIssue(ParseIssue.superfluous("foo=\"x\"", new SingleLineSpan(0, 20, 7))).getMessage(),
				is("superfluous \"foo=\"x\"\" at line 1 column 21"));
		assertThat(new UnparsableIssue("missing \"=\"", new SingleLineSpan(3, 0, 4)).getMessage(),
				is("unparsable: missing \"=\" at line 4 column 1"));
		assertThat(new SpelSyntaxIssue("name", new SpelSyntaxError("unexpected end"), new SingleLineSpan(0, 5, 1))
				.getMessage(), is("invalid value of attribute \"name\": unexpected end at line 1 column 6"));
		assertThat(new DocumentParseIssue(new SpmlParseException("document is empty")).getMessage(),
				is("unable to parse document: document is empty"));
		assertThat(new IOErrorIssue(new IOException("boom")).getMessage(), is("IO Error: java.io.IOException: boom"));
	}

	@Test
	public void errorNodeContentIsShortened() {
		ErrorNode multiLine = new ErrorNode("<%@ include\nfile", new Range(new Position(2, 0), new Position(3, 4)));
		assertThat(new ErrorNodeIssue(multiLine).getMessage(), is("unexpected \"<%@ include...\" at line 3 column 1"));

		String content = "0123456789012345678901234567890123456789xyz";
		ErrorNode longNode = new ErrorNode(content, new Range(new Position(0, 0), new Position(0, content.length())));
		assertThat(new ErrorNodeIssue(longNode).getMessage(),
				is("unexpected \"0123456789012345678901234567890123456789...\" at line 1 column 1"));
	}

	@Test
	public void issuesWithoutLocation() {
		assertFalse(new IOErrorIssue(new IOException("boom")).getSpan().isPresent());
		assertFalse(new DocumentParseIssue(new SpmlParseException("x")).getSpan().isPresent());
	}
}
