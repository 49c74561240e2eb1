package spml.errors;

public abstract class ParseIssueVisitor<T, E extends Throwable> {
	public abstract T visit(ParseIssue.Superfluous superfluous) throws E;
	public abstract T visit(ParseIssue.Missing missing) throws E;
}
