package spml.errors;

import spml.parser.SpmlParseException;

@SuppressWarnings("serial")
public class DocumentParseIssue extends Issue {
	private final SpmlParseException error;

	public DocumentParseIssue(SpmlParseException error) {
		this.error = error;
	}

	public SpmlParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
