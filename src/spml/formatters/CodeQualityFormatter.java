package spml.formatters;

import org.json.JSONArray;
import org.json.JSONObject;
import spml.errors.ContextVisitor;
import spml.errors.DocumentParseIssue;
import spml.errors.ErrorNodeIssue;
import spml.errors.IOErrorIssue;
import spml.errors.InFile;
import spml.errors.Issue;
import spml.errors.IssueVisitor;
import spml.errors.IssueWithContext;
import spml.errors.SpelSyntaxIssue;
import spml.errors.StructuralIssue;
import spml.errors.UnparsableIssue;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Renders issues as a GitLab code quality report: a JSON array with one object per issue.
 */
public class CodeQualityFormatter {

	private CodeQualityFormatter() {}

	public static JSONArray format(List<Issue> issues) {
		JSONArray report = new JSONArray();
		for (Issue issue : issues) {
			report.put(format(issue));
		}
		return report;
	}

	public static JSONObject format(Issue issue) {
		Entry entry = new Entry();
		issue.accept(entry);
		String description = describe(entry.issue);
		int line = issue.getSpan().map(span -> span.start().getLine() + 1).orElse(1);

		JSONObject lines = new JSONObject();
		lines.put("begin", line);
		JSONObject location = new JSONObject();
		location.put("path", entry.path);
		location.put("lines", lines);

		JSONObject result = new JSONObject();
		result.put("description", description);
		result.put("check_name", entry.checkName);
		result.put("fingerprint", fingerprint(entry.path + ":" + line + ":" + description));
		result.put("severity", entry.severity);
		result.put("location", location);
		return result;
	}

	private static String describe(Issue issue) {
		StringWriter w = new StringWriter();
		try {
			issue.accept(new IssueFormattingVisitor(new IndentingWriter(w)));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

	private static String fingerprint(String text) {
		try {
			MessageDigest digest = MessageDigest.getInstance("MD5");
			StringBuilder hex = new StringBuilder();
			for (byte b : digest.digest(text.getBytes(StandardCharsets.UTF_8))) {
				hex.append(String.format("%02x", b));
			}
			return hex.toString();
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("every JVM provides MD5", e);
		}
	}

	/**
	 * Unwraps contexts down to the issue itself, noting the file and classifying the issue on the way.
	 */
	private static final class Entry extends IssueVisitor<Void, RuntimeException> {
		private String path = "";
		private String checkName;
		private String severity;
		private Issue issue;

		private void set(Issue issue, String checkName, String severity) {
			this.issue = issue;
			this.checkName = checkName;
			this.severity = severity;
		}

		@Override
		public Void visit(IssueWithContext issueWithContext) {
			issueWithContext.getContext().accept(new ContextVisitor<Void, RuntimeException>() {
				@Override
				public Void visit(InFile inFile) {
					path = inFile.getPath();
					return null;
				}
			});
			return issueWithContext.getIssue().accept(this);
		}

		@Override
		public Void visit(StructuralIssue structuralIssue) {
			set(structuralIssue, "spml-structure", "minor");
			return null;
		}

		@Override
		public Void visit(UnparsableIssue unparsableIssue) {
			set(unparsableIssue, "spml-unparsable", "major");
			return null;
		}

		@Override
		public Void visit(ErrorNodeIssue errorNodeIssue) {
			set(errorNodeIssue, "spml-syntax", "major");
			return null;
		}

		@Override
		public Void visit(SpelSyntaxIssue spelSyntaxIssue) {
			set(spelSyntaxIssue, "spel-syntax", "major");
			return null;
		}

		@Override
		public Void visit(DocumentParseIssue documentParseIssue) {
			set(documentParseIssue, "spml-document", "critical");
			return null;
		}

		@Override
		public Void visit(IOErrorIssue ioErrorIssue) {
			set(ioErrorIssue, "io", "critical");
			return null;
		}
	}
}
