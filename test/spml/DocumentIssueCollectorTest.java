package spml;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import spml.errors.ErrorNodeIssue;
import spml.errors.Issue;
import spml.errors.ParseIssue;
import spml.errors.SpelSyntaxIssue;
import spml.errors.StructuralIssue;
import spml.errors.TopLevelIssueContext;
import spml.errors.UnparsableIssue;
import spml.model.schema.TagSchema;
import spml.parser.DocumentParser;
import spml.parser.SpmlParseException;
import spml.util.Position;
import spml.util.SingleLineSpan;
import spml.util.Span;

public class DocumentIssueCollectorTest {
	private static TagSchema schema;

	@BeforeClass
	public static void loadSchema() throws IOException {
		schema = TagSchema.load();
	}

	private static List<Issue> collect(String text, boolean includeSyntaxErrors) throws SpmlParseException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		DocumentIssueCollector.collect(ctx, DocumentParser.parse(text, schema), includeSyntaxErrors);
		return ctx.getIssues();
	}

	@Test
	public void cleanDocument() throws SpmlParseException {
		assertTrue(collect("<div class=\"a\">\n  <sp:print name=\"_a\"/>\n</div>", true).isEmpty());
	}

	@Test
	public void spelErrorWithoutFixCoversAttributeValue() throws SpmlParseException {
		List<Issue> issues = collect("<sp:print name=\"${_x\"/>", true);
		assertThat(issues.size(), is(1));
		SpelSyntaxIssue issue = (SpelSyntaxIssue) issues.get(0);
		assertThat(issue.getAttribute(), is("name"));
		assertThat(issue.getSpan().get(), is(new SingleLineSpan(0, 15, 6)));
	}

	@Test
	public void spelErrorsCanBeExcluded() throws SpmlParseException {
		assertTrue(collect("<sp:print name=\"${_x\"/>", false).isEmpty());
	}

	@Test
	public void spelErrorPointsAtFix() throws SpmlParseException {
		List<Issue> issues = collect("<sp:print expression=\"${a} b\"/>", true);
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0), instanceOf(SpelSyntaxIssue.class));
		assertThat(issues.get(0).getSpan().get(), is(new SingleLineSpan(0, 26, 2)));
	}

	@Test
	public void spelErrorAfterLineBreak() throws SpmlParseException {
		List<Issue> issues = collect("<sp:print expression=\"${a}\n b\"/>", true);
		assertThat(issues.size(), is(1));
		Span span = issues.get(0).getSpan().get();
		assertThat(span.start(), is(new Position(0, 26)));
		assertThat(span.end(), is(new Position(1, 2)));
	}

	@Test
	public void unparsableAttribute() throws SpmlParseException {
		List<Issue> issues = collect("<sp:print name=_x/>", true);
		assertThat(issues.size(), is(1));
		UnparsableIssue issue = (UnparsableIssue) issues.get(0);
		assertThat(issue.getReason(), is("expected attribute value, found \"_x\""));
	}

	@Test
	public void missingClosingTag() throws SpmlParseException {
		List<Issue> issues = collect("<sp:if name=\"_a\">\n  hello\n", true);
		assertThat(issues.size(), is(1));
		StructuralIssue issue = (StructuralIssue) issues.get(0);
		assertThat(issue.getParseIssue(), is(ParseIssue.missing("</sp:if>", new SingleLineSpan(1, 7, 0))));
	}

	@Test
	public void errorNodesInBodies() throws SpmlParseException {
		List<Issue> issues = collect("<div>\n</span>\n</div>", true);
		assertThat(issues.size(), is(1));
		assertThat(issues.get(0), instanceOf(ErrorNodeIssue.class));
		assertThat(issues.get(0).getSpan().get(), is(new SingleLineSpan(1, 0, 7)));
	}
}
