package spml.model.spel;

public abstract class SpelNodeVisitor<T, E extends Throwable> {
	public abstract T visit(SpelText text) throws E;
	public abstract T visit(SpelString spelString) throws E;
	public abstract T visit(SpelInterpolation interpolation) throws E;
	public abstract T visit(SpelWord word) throws E;
	public abstract T visit(SpelNull spelNull) throws E;
	public abstract T visit(SpelAnchor anchor) throws E;
	public abstract T visit(SpelFunction function) throws E;
	public abstract T visit(SpelFunctionArgument functionArgument) throws E;
	public abstract T visit(SpelFieldAccess fieldAccess) throws E;
	public abstract T visit(SpelMethodAccess methodAccess) throws E;
	public abstract T visit(SpelArrayAccess arrayAccess) throws E;
	public abstract T visit(SpelNumber number) throws E;
	public abstract T visit(SpelSignedNumber signedNumber) throws E;
	public abstract T visit(SpelSignedExpression signedExpression) throws E;
	public abstract T visit(SpelBracketedExpression bracketedExpression) throws E;
	public abstract T visit(SpelBinaryExpression binaryExpression) throws E;
	public abstract T visit(SpelTernary ternary) throws E;
	public abstract T visit(SpelBoolean spelBoolean) throws E;
	public abstract T visit(SpelBinaryCondition binaryCondition) throws E;
	public abstract T visit(SpelBracketedCondition bracketedCondition) throws E;
	public abstract T visit(SpelNegatedCondition negatedCondition) throws E;
	public abstract T visit(SpelComparison comparison) throws E;
	public abstract T visit(SpelIdentifierAccess identifierAccess) throws E;
	public abstract T visit(SpelUriLiteral uriLiteral) throws E;
	public abstract T visit(SpelUriFragment uriFragment) throws E;
	public abstract T visit(SpelUriFileExtension uriFileExtension) throws E;
	public abstract T visit(SpelRegex regex) throws E;
	public abstract T visit(SpelQuery query) throws E;
}
