package spml.errors;

import java.io.IOException;

@SuppressWarnings("serial")
public class IOErrorIssue extends Issue {
	private final IOException error;

	public IOErrorIssue(IOException e) {
		this.error = e;
	}

	public IOException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
