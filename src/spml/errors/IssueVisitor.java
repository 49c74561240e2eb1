package spml.errors;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(StructuralIssue structuralIssue) throws E;
	public abstract T visit(UnparsableIssue unparsableIssue) throws E;
	public abstract T visit(ErrorNodeIssue errorNodeIssue) throws E;
	public abstract T visit(SpelSyntaxIssue spelSyntaxIssue) throws E;
	public abstract T visit(DocumentParseIssue documentParseIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
}
