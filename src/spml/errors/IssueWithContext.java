package spml.errors;

import spml.util.Span;

import java.util.Optional;

@SuppressWarnings("serial")
public class IssueWithContext extends Issue {
	private final Issue issue;
	private final Context context;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public Optional<Span> getSpan() {
		return issue.getSpan();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
