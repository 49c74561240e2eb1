package spml.formatters;

import spml.model.spel.*;

import java.io.IOException;
import java.util.List;

/**
 * Prints SPEL nodes back into source form. Insignificant whitespace is normalized, so
 * <code>1+2</code> prints as <code>1 + 2</code>.
 */
public class SpelFormattingVisitor extends SpelNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public SpelFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeBinary(SpelElement left, String operator, SpelElement right) throws IOException {
		left.accept(this);
		out.write(" ");
		out.write(operator);
		out.write(" ");
		right.accept(this);
	}

	private void writeAll(List<? extends SpelElement> elements, String separator) throws IOException {
		boolean first = true;
		for (SpelElement element : elements) {
			if (first) {
				first = false;
			} else {
				out.write(separator);
			}
			element.accept(this);
		}
	}

	@Override
	public Void visit(SpelText text) throws IOException {
		out.write(text.getContent());
		return null;
	}

	@Override
	public Void visit(SpelString string) throws IOException {
		out.write("'");
		out.write(string.getContent());
		out.write("'");
		return null;
	}

	@Override
	public Void visit(SpelInterpolation interpolation) throws IOException {
		out.write("${");
		interpolation.getContent().accept(this);
		out.write("}");
		return null;
	}

	@Override
	public Void visit(SpelWord word) throws IOException {
		writeAll(word.getFragments(), "");
		return null;
	}

	@Override
	public Void visit(SpelNull spelNull) throws IOException {
		out.write("null");
		return null;
	}

	@Override
	public Void visit(SpelAnchor anchor) throws IOException {
		out.write("!{");
		anchor.getName().accept(this);
		out.write("}");
		return null;
	}

	@Override
	public Void visit(SpelFunction function) throws IOException {
		out.write(function.getName());
		out.write("(");
		writeAll(function.getArguments(), ", ");
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SpelFunctionArgument functionArgument) throws IOException {
		functionArgument.getArgument().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelFieldAccess fieldAccess) throws IOException {
		fieldAccess.getObject().accept(this);
		out.write(".");
		fieldAccess.getField().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelMethodAccess methodAccess) throws IOException {
		methodAccess.getObject().accept(this);
		out.write(".");
		methodAccess.getFunction().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelArrayAccess arrayAccess) throws IOException {
		arrayAccess.getObject().accept(this);
		out.write("[");
		arrayAccess.getIndex().accept(this);
		out.write("]");
		return null;
	}

	@Override
	public Void visit(SpelNumber number) throws IOException {
		out.write(number.getContent());
		return null;
	}

	@Override
	public Void visit(SpelSignedNumber signedNumber) throws IOException {
		out.write(signedNumber.getSign().getSymbol());
		signedNumber.getNumber().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelSignedExpression signedExpression) throws IOException {
		out.write(signedExpression.getSign().getSymbol());
		signedExpression.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelBracketedExpression bracketedExpression) throws IOException {
		out.write("(");
		bracketedExpression.getExpression().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SpelBinaryExpression binaryExpression) throws IOException {
		writeBinary(binaryExpression.getLeft(), String.valueOf(binaryExpression.getOperator().getSymbol()),
				binaryExpression.getRight());
		return null;
	}

	@Override
	public Void visit(SpelTernary ternary) throws IOException {
		ternary.getCondition().accept(this);
		out.write(" ? ");
		ternary.getLeft().accept(this);
		out.write(" : ");
		ternary.getRight().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelBoolean spelBoolean) throws IOException {
		out.write(spelBoolean.isValue() ? "true" : "false");
		return null;
	}

	@Override
	public Void visit(SpelBinaryCondition binaryCondition) throws IOException {
		writeBinary(binaryCondition.getLeft(), binaryCondition.getOperator().getSymbol(), binaryCondition.getRight());
		return null;
	}

	@Override
	public Void visit(SpelBracketedCondition bracketedCondition) throws IOException {
		out.write("(");
		bracketedCondition.getCondition().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(SpelNegatedCondition negatedCondition) throws IOException {
		out.write("!");
		negatedCondition.getCondition().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelComparison comparison) throws IOException {
		writeBinary(comparison.getLeft(), comparison.getOperator().getSymbol(), comparison.getRight());
		return null;
	}

	@Override
	public Void visit(SpelIdentifierAccess identifierAccess) throws IOException {
		identifierAccess.getIdentifier().accept(this);
		out.write(".");
		identifierAccess.getField().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelUriLiteral uriLiteral) throws IOException {
		writeAll(uriLiteral.getFragments(), "");
		if (uriLiteral.getFileExtension().isPresent()) {
			uriLiteral.getFileExtension().get().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(SpelUriFragment uriFragment) throws IOException {
		out.write("/");
		uriFragment.getContent().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelUriFileExtension uriFileExtension) throws IOException {
		out.write(".");
		uriFileExtension.getContent().accept(this);
		return null;
	}

	@Override
	public Void visit(SpelRegex regex) throws IOException {
		out.write(regex.getContent());
		return null;
	}

	@Override
	public Void visit(SpelQuery query) throws IOException {
		out.write(query.getContent());
		return null;
	}
}
