package spml.parser;

import spml.model.spel.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders SPEL trees as prefix notation so tests can assert on their shape, e.g. <code>(+ 1 (* 2 3))</code>.
 * Brackets from the source show up as <code>(paren x)</code>.
 */
public class SpelStructurePrinter extends SpelNodeVisitor<String, RuntimeException> {

	public static String print(SpelElement element) {
		return element.accept(new SpelStructurePrinter());
	}

	private String all(List<? extends SpelElement> elements, String separator) {
		return elements.stream().map(e -> e.accept(this)).collect(Collectors.joining(separator));
	}

	private String prefix(String operator, SpelElement... operands) {
		StringBuilder result = new StringBuilder("(").append(operator);
		for (SpelElement operand : operands) {
			result.append(' ').append(operand.accept(this));
		}
		return result.append(')').toString();
	}

	@Override
	public String visit(SpelText text) {
		return text.getContent();
	}

	@Override
	public String visit(SpelString spelString) {
		return "'" + spelString.getContent() + "'";
	}

	@Override
	public String visit(SpelInterpolation interpolation) {
		return "${" + interpolation.getContent().accept(this) + "}";
	}

	@Override
	public String visit(SpelWord word) {
		return all(word.getFragments(), "");
	}

	@Override
	public String visit(SpelNull spelNull) {
		return "null";
	}

	@Override
	public String visit(SpelAnchor anchor) {
		return "!{" + anchor.getName().accept(this) + "}";
	}

	@Override
	public String visit(SpelFunction function) {
		return function.getName() + "(" + all(function.getArguments(), ", ") + ")";
	}

	@Override
	public String visit(SpelFunctionArgument functionArgument) {
		return functionArgument.getArgument().accept(this);
	}

	@Override
	public String visit(SpelFieldAccess fieldAccess) {
		return prefix(".", fieldAccess.getObject(), fieldAccess.getField());
	}

	@Override
	public String visit(SpelMethodAccess methodAccess) {
		return prefix(".", methodAccess.getObject(), methodAccess.getFunction());
	}

	@Override
	public String visit(SpelArrayAccess arrayAccess) {
		return prefix("[]", arrayAccess.getObject(), arrayAccess.getIndex());
	}

	@Override
	public String visit(SpelNumber number) {
		return number.getContent();
	}

	@Override
	public String visit(SpelSignedNumber signedNumber) {
		return signedNumber.getSign().getSymbol() + signedNumber.getNumber().accept(this);
	}

	@Override
	public String visit(SpelSignedExpression signedExpression) {
		return signedExpression.getSign().getSymbol() + signedExpression.getExpression().accept(this);
	}

	@Override
	public String visit(SpelBracketedExpression bracketedExpression) {
		return prefix("paren", bracketedExpression.getExpression());
	}

	@Override
	public String visit(SpelBinaryExpression binaryExpression) {
		return prefix(String.valueOf(binaryExpression.getOperator().getSymbol()),
				binaryExpression.getLeft(), binaryExpression.getRight());
	}

	@Override
	public String visit(SpelTernary ternary) {
		return prefix("?", ternary.getCondition(), ternary.getLeft(), ternary.getRight());
	}

	@Override
	public String visit(SpelBoolean spelBoolean) {
		return String.valueOf(spelBoolean.isValue());
	}

	@Override
	public String visit(SpelBinaryCondition binaryCondition) {
		return prefix(binaryCondition.getOperator().getSymbol(), binaryCondition.getLeft(), binaryCondition.getRight());
	}

	@Override
	public String visit(SpelBracketedCondition bracketedCondition) {
		return prefix("paren", bracketedCondition.getCondition());
	}

	@Override
	public String visit(SpelNegatedCondition negatedCondition) {
		return prefix("!", negatedCondition.getCondition());
	}

	@Override
	public String visit(SpelComparison comparison) {
		return prefix(comparison.getOperator().getSymbol(), comparison.getLeft(), comparison.getRight());
	}

	@Override
	public String visit(SpelIdentifierAccess identifierAccess) {
		return prefix(".", identifierAccess.getIdentifier(), identifierAccess.getField());
	}

	@Override
	public String visit(SpelUriLiteral uriLiteral) {
		String result = all(uriLiteral.getFragments(), "");
		if (uriLiteral.getFileExtension().isPresent()) {
			result += uriLiteral.getFileExtension().get().accept(this);
		}
		return result;
	}

	@Override
	public String visit(SpelUriFragment uriFragment) {
		return "/" + uriFragment.getContent().accept(this);
	}

	@Override
	public String visit(SpelUriFileExtension uriFileExtension) {
		return "." + uriFileExtension.getContent().accept(this);
	}

	@Override
	public String visit(SpelRegex regex) {
		return regex.getContent();
	}

	@Override
	public String visit(SpelQuery query) {
		return query.getContent();
	}
}
