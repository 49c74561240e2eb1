package spml.parser;

import spml.lexer.SpelScanner;
import spml.model.spel.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser for SPEL, the expression language of SPML attribute values.
 *
 * One instance parses one text with one of the {@link SpelGrammar}s and is discarded afterwards. Parsing stops at
 * the first problem, which is reported as a {@link SpelSyntaxError}. Some errors come with proposed fixes.
 */
public class SpelParser {
	private static final char[] ANCHOR_CHARACTERS = {'.'};
	private static final char[] NO_ADDITIONAL_CHARACTERS = {};

	private final String text;
	private final SpelScanner scanner;

	public SpelParser(String text) {
		this.text = text;
		this.scanner = new SpelScanner(text);
	}

	/**
	 * Parses text with the given grammar.
	 *
	 * Comparable attribute values also accept plain text: if text is not a comparable, the scanner is rewound and
	 * the text is read as a {@link SpelGrammar#WORD}.
	 */
	public static SpelAst parse(SpelGrammar grammar, String text) {
		SpelParser parser = new SpelParser(text);
		switch (grammar) {
			case COMPARABLE:
				int start = parser.scanner.mark();
				SpelResult<SpelComparable> comparable = parser.parseComparableAst();
				if (!comparable.isValid()) {
					parser.scanner.reset(start);
					SpelResult<SpelWord> word = parser.parseText();
					if (word.isValid()) {
						return new SpelAst(SpelGrammar.WORD, word);
					}
				}
				return new SpelAst(grammar, comparable);
			case CONDITION:
				return new SpelAst(grammar, parser.parseConditionAst());
			case EXPRESSION:
				return new SpelAst(grammar, parser.parseExpressionAst());
			case IDENTIFIER:
				return new SpelAst(grammar, parser.parseIdentifier());
			case OBJECT:
				return new SpelAst(grammar, parser.parseObjectAst());
			case QUERY:
				return new SpelAst(grammar, parser.parseQuery());
			case REGEX:
				return new SpelAst(grammar, parser.parseRegex());
			case WORD:
				return new SpelAst(grammar, parser.parseText());
			case URI:
				return new SpelAst(grammar, parser.parseUri());
			default:
				throw new IllegalArgumentException("unknown grammar " + grammar);
		}
	}

	public SpelResult<SpelObject> parseObjectAst() {
		try {
			requireContent();
			SpelObject root = parseObject();
			requireEnd();
			return SpelResult.valid(root);
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	public SpelResult<SpelExpression> parseExpressionAst() {
		try {
			requireContent();
			SpelExpression root = parseExpression();
			requireEnd();
			return SpelResult.valid(root);
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	public SpelResult<SpelCondition> parseConditionAst() {
		try {
			requireContent();
			SpelCondition root = parseCondition();
			requireEnd();
			return SpelResult.valid(root);
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	/**
	 * Parses a single comparable operand. Unlike operands inside of conditions, plain names are rejected here.
	 */
	public SpelResult<SpelComparable> parseComparableAst() {
		try {
			requireContent();
			SpelComparable root = parseComparable(false);
			requireEnd();
			return SpelResult.valid(root);
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	/**
	 * Parses text with embedded interpolations. Everything that is not an interpolation is kept as is, so this only
	 * fails on broken interpolations.
	 */
	public SpelResult<SpelWord> parseText() {
		try {
			List<SpelWordFragment> fragments = new ArrayList<>();
			StringBuilder string = new StringBuilder();
			int start = scanner.getCursor();
			while (!scanner.isDone()) {
				if (scanner.peekIs('$')) {
					SpelInterpolation interpolation = parseInterpolation();
					if (string.length() > 0) {
						fragments.add(new SpelText(string.toString(), SpelLocation.variable(start, string.length())));
						string.setLength(0);
					}
					fragments.add(interpolation);
					start = scanner.getCursor();
				} else {
					string.append(scanner.pop().get());
				}
			}
			if (string.length() > 0 || fragments.isEmpty()) {
				fragments.add(new SpelText(string.toString(), SpelLocation.variable(start, string.length())));
			}
			return SpelResult.valid(new SpelWord(fragments));
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	public SpelResult<SpelUri> parseUri() {
		try {
			List<SpelUriFragment> fragments = new ArrayList<>();
			scanner.skipWhitespace();
			while (true) {
				Optional<Character> next = scanner.peek();
				if (!next.isPresent()) {
					return SpelResult.valid(new SpelUriLiteral(fragments, null));
				}
				char c = next.get();
				if (c == '/') {
					SpelLocation slashLocation = SpelLocation.single(scanner.getCursor());
					scanner.pop();
					fragments.add(new SpelUriFragment(slashLocation, parseWord()));
				} else if (c == '.' && !fragments.isEmpty()) {
					SpelLocation dotLocation = SpelLocation.single(scanner.getCursor());
					scanner.pop();
					SpelUriFileExtension extension = new SpelUriFileExtension(dotLocation, parseWord());
					requireEnd();
					return SpelResult.valid(new SpelUriLiteral(fragments, extension));
				} else if (c == '$' && fragments.isEmpty()) {
					SpelInterpolation interpolation = parseInterpolation();
					requireEnd();
					return SpelResult.valid(interpolation);
				} else {
					throw unexpectedChar(c);
				}
			}
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	public SpelResult<SpelRegex> parseRegex() {
		if (scanner.isDone()) {
			return SpelResult.invalid(new SpelSyntaxError("string is empty"));
		}
		int start = scanner.getCursor();
		String content = scanner.rest();
		scanner.reset(scanner.length());
		return SpelResult.valid(new SpelRegex(content, SpelLocation.variable(start, content.length())));
	}

	public SpelResult<SpelQuery> parseQuery() {
		if (scanner.isDone()) {
			return SpelResult.invalid(new SpelSyntaxError("string is empty"));
		}
		int start = scanner.getCursor();
		String content = scanner.rest();
		scanner.reset(scanner.length());
		return SpelResult.valid(new SpelQuery(content, SpelLocation.variable(start, content.length())));
	}

	public SpelResult<SpelIdentifier> parseIdentifier() {
		try {
			requireContent();
			SpelIdentifier result = parseWord();
			scanner.skipWhitespace();
			while (!scanner.isDone()) {
				if (!scanner.peekIs('.')) {
					throw trailingCharacters();
				}
				SpelLocation dotLocation = SpelLocation.single(scanner.getCursor());
				scanner.pop();
				scanner.skipWhitespace();
				SpelWord field = parseWord();
				scanner.skipWhitespace();
				result = new SpelIdentifierAccess(result, field, dotLocation);
			}
			return SpelResult.valid(result);
		} catch (SpelSyntaxException e) {
			return SpelResult.invalid(e.getError());
		}
	}

	private void requireContent() throws SpelSyntaxException {
		scanner.skipWhitespace();
		if (scanner.isDone()) {
			throw new SpelSyntaxException("string is empty");
		}
	}

	private void requireEnd() throws SpelSyntaxException {
		scanner.skipWhitespace();
		if (!scanner.isDone()) {
			throw trailingCharacters();
		}
	}

	private SpelSyntaxException trailingCharacters() {
		int rootEnd = scanner.subtractWhitespace() + 1;
		return new SpelSyntaxException("trailing \"" + scanner.rest() + "\". try removing it",
				SpelSyntaxFix.delete(SpelLocation.variable(rootEnd, text.length() - rootEnd)));
	}

	private static SpelSyntaxException unexpectedChar(char c) {
		return new SpelSyntaxException("unexpected char \"" + c + "\"");
	}

	private static SpelSyntaxException unexpectedEnd() {
		return new SpelSyntaxException("unexpected end");
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isWordCharacter(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDigit(c) || c == '_' || c == '-' || c == '*';
	}

	// objects

	private SpelObject parseObject() throws SpelSyntaxException {
		Optional<Character> next = scanner.peek();
		if (!next.isPresent()) {
			throw unexpectedEnd();
		}
		char c = next.get();
		SpelObject object;
		if (c == '\'') {
			object = parseString();
		} else if (c == '!') {
			object = parseAnchor();
		} else if (c == '$' || c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')) {
			object = parseNameOrGlobalFunction();
		} else {
			throw unexpectedChar(c);
		}
		return parseObjectAccess(object);
	}

	private SpelObject parseNameOrGlobalFunction() throws SpelSyntaxException {
		SpelWord name = parseWord();
		Optional<SpelText> plainName = plainName(name);
		if (plainName.isPresent()) {
			scanner.skipWhitespace();
			if (scanner.peekIs('(')) {
				return parseFunction(plainName.get());
			}
		}
		return name;
	}

	private SpelFunction parseFunction(SpelText name) throws SpelSyntaxException {
		int start = scanner.getCursor();
		List<SpelFunctionArgument> arguments = parseFunctionArguments();
		return new SpelFunction(name.getContent(), name.getLocation(), arguments, SpelLocation.single(start),
				SpelLocation.single(scanner.getCursor() - 1));
	}

	/**
	 * @return the only fragment of word, if it is not interpolated
	 */
	private static Optional<SpelText> plainName(SpelWord word) {
		if (word.getFragments().size() == 1 && word.getFragments().get(0) instanceof SpelText) {
			return Optional.of((SpelText) word.getFragments().get(0));
		}
		return Optional.empty();
	}

	private static Optional<SpelInterpolation> interpolatedName(SpelWord word) {
		if (word.getFragments().size() == 1 && word.getFragments().get(0) instanceof SpelInterpolation) {
			return Optional.of((SpelInterpolation) word.getFragments().get(0));
		}
		return Optional.empty();
	}

	private SpelObject parseObjectAccess(SpelObject object) throws SpelSyntaxException {
		while (true) {
			scanner.skipWhitespace();
			if (scanner.peekIs('[')) {
				int start = scanner.getCursor();
				scanner.pop();
				scanner.skipWhitespace();
				SpelExpression index = parseExpression();
				scanner.skipWhitespace();
				if (!scanner.take(']')) {
					throw new SpelSyntaxException("unclosed array access. try adding the missing bracket",
							SpelSyntaxFix.insert(scanner.getCursor(), "]"));
				}
				object = new SpelArrayAccess(object, index, SpelLocation.single(start),
						SpelLocation.single(scanner.getCursor() - 1));
			} else if (scanner.peekIs('.')) {
				SpelLocation dotLocation = SpelLocation.single(scanner.getCursor());
				scanner.pop();
				scanner.skipWhitespace();
				SpelWord name = parseWord();
				scanner.skipWhitespace();
				Optional<SpelText> methodName = plainName(name);
				if (methodName.isPresent() && scanner.peekIs('(')) {
					object = new SpelMethodAccess(object, parseFunction(methodName.get()), dotLocation);
				} else {
					object = new SpelFieldAccess(object, name, dotLocation);
				}
			} else {
				return object;
			}
		}
	}

	private SpelWord parseWord() throws SpelSyntaxException {
		return parseWord(NO_ADDITIONAL_CHARACTERS);
	}

	private SpelWord parseWord(char[] additionalCharacters) throws SpelSyntaxException {
		List<SpelWordFragment> fragments = new ArrayList<>();
		StringBuilder string = new StringBuilder();
		int start = scanner.getCursor();
		while (!scanner.isDone()) {
			char c = scanner.peek().get();
			if (isWordCharacter(c) || contains(additionalCharacters, c)) {
				string.append(c);
				scanner.pop();
			} else if (c == '$') {
				SpelInterpolation interpolation = parseInterpolation();
				if (string.length() > 0) {
					fragments.add(new SpelText(string.toString(), SpelLocation.variable(start, string.length())));
					string.setLength(0);
				}
				fragments.add(interpolation);
				start = scanner.getCursor();
			} else {
				break;
			}
		}
		if (string.length() > 0) {
			fragments.add(new SpelText(string.toString(), SpelLocation.variable(start, string.length())));
		}
		if (fragments.isEmpty()) {
			Optional<Character> next = scanner.peek();
			if (next.isPresent()) {
				throw unexpectedChar(next.get());
			}
			throw unexpectedEnd();
		}
		return new SpelWord(fragments);
	}

	private static boolean contains(char[] characters, char c) {
		for (char candidate : characters) {
			if (candidate == c) {
				return true;
			}
		}
		return false;
	}

	private SpelInterpolation parseInterpolation() throws SpelSyntaxException {
		int start = scanner.getCursor();
		if (!scanner.take("${")) {
			throw new SpelSyntaxException("expected interpolation");
		}
		scanner.skipWhitespace();
		SpelObject content = parseObject();
		scanner.skipWhitespace();
		Optional<Character> next = scanner.pop();
		if (!next.isPresent()) {
			throw new SpelSyntaxException("unclosed interpolation. try adding the missing bracket");
		}
		if (next.get() != '}') {
			throw unexpectedChar(next.get());
		}
		return new SpelInterpolation(content, SpelLocation.pair(start), SpelLocation.single(scanner.getCursor() - 1));
	}

	private SpelAnchor parseAnchor() throws SpelSyntaxException {
		int start = scanner.getCursor();
		if (!scanner.take("!{")) {
			throw new SpelSyntaxException("expected `{` after `!` for an interpolated anchor. try adding it",
					SpelSyntaxFix.insert(scanner.getCursor() + 1, "{"));
		}
		scanner.skipWhitespace();
		SpelWord name = parseWord(ANCHOR_CHARACTERS);
		scanner.skipWhitespace();
		Optional<Character> next = scanner.pop();
		if (!next.isPresent()) {
			throw new SpelSyntaxException("unclosed anchor interpolation. try adding the missing bracket",
					SpelSyntaxFix.insert(scanner.getCursor(), "}"));
		}
		if (next.get() != '}') {
			throw unexpectedChar(next.get());
		}
		return new SpelAnchor(name, SpelLocation.pair(start), SpelLocation.single(scanner.getCursor() - 1));
	}

	private SpelString parseString() throws SpelSyntaxException {
		int start = scanner.getCursor();
		if (!scanner.take('\'')) {
			throw new SpelSyntaxException("expected string");
		}
		StringBuilder content = new StringBuilder();
		while (true) {
			Optional<Character> next = scanner.peek();
			if (!next.isPresent()) {
				throw new SpelSyntaxException("missing qoute. try adding adding it",
						SpelSyntaxFix.insert(scanner.getCursor(), "'"));
			}
			char c = next.get();
			if (c == '\\') {
				scanner.pop();
				Optional<Character> escaped = scanner.pop();
				if (!escaped.isPresent()) {
					throw new SpelSyntaxException("missing qoute. try adding adding it",
							SpelSyntaxFix.insert(scanner.getCursor(), "\\'"));
				}
				switch (escaped.get()) {
					case 'b':
					case 't':
					case 'n':
					case 'f':
					case 'r':
					case '"':
					case '\'':
					case '\\':
					case 'u':
						content.append('\\').append(escaped.get());
						break;
					default:
						throw new SpelSyntaxException(
								"invalid escape sequence `\\" + escaped.get() + "`. did you mean `\\\\`?",
								SpelSyntaxFix.insert(scanner.getCursor(), "\\"));
				}
			} else if (c == '\'') {
				scanner.pop();
				return new SpelString(content.toString(), SpelLocation.variable(start, content.length() + 2));
			} else if (c < 128) {
				content.append(c);
				scanner.pop();
			} else {
				throw new SpelSyntaxException("invalid character \"" + c + "\"");
			}
		}
	}

	private List<SpelFunctionArgument> parseFunctionArguments() throws SpelSyntaxException {
		List<SpelFunctionArgument> arguments = new ArrayList<>();
		if (!scanner.take('(')) {
			throw new SpelSyntaxException("expected opening brace");
		}
		scanner.skipWhitespace();
		if (scanner.take(')')) {
			return arguments;
		}
		while (true) {
			SpelArgument argument = parseArgument(arguments);
			scanner.skipWhitespace();
			Optional<Character> next = scanner.pop();
			if (!next.isPresent()) {
				throw new SpelSyntaxException("unclosed function arguments. try adding the missing bracket",
						SpelSyntaxFix.insert(scanner.getCursor(), ")"));
			}
			if (next.get() == ')') {
				arguments.add(new SpelFunctionArgument(argument, null));
				return arguments;
			}
			if (next.get() != ',') {
				throw unexpectedChar(next.get());
			}
			arguments.add(new SpelFunctionArgument(argument, SpelLocation.single(scanner.getCursor() - 1)));
			scanner.skipWhitespace();
		}
	}

	private SpelArgument parseArgument(List<SpelFunctionArgument> previous) throws SpelSyntaxException {
		Optional<Character> next = scanner.peek();
		if (!next.isPresent()) {
			SpelSyntaxFix fix = previous.isEmpty()
					? SpelSyntaxFix.insert(scanner.getCursor(), ")")
					: previous.get(previous.size() - 1).getCommaLocation()
							.<SpelSyntaxFix>map(comma -> SpelSyntaxFix.replace(comma, ")"))
							.orElse(SpelSyntaxFix.insert(scanner.getCursor(), ")"));
			throw new SpelSyntaxException("unclosed function arguments. try adding the missing bracket", fix);
		}
		char c = next.get();
		if (c == '\'') {
			return parseString();
		}
		if (c == '!') {
			return parseAnchor();
		}
		if (c == '$') {
			return parseInterpolation();
		}
		if (isDigit(c)) {
			return parseNumber();
		}
		if (c == '-' || c == '+') {
			SpelSign sign = c == '+' ? SpelSign.PLUS : SpelSign.MINUS;
			SpelLocation signLocation = SpelLocation.single(scanner.getCursor());
			scanner.pop();
			scanner.skipWhitespace();
			return new SpelSignedNumber(sign, signLocation, parseNumber());
		}
		SpelObject object = parseNameOrGlobalFunction();
		if (object instanceof SpelFunction) {
			return (SpelFunction) object;
		}
		SpelWord word = (SpelWord) object;
		Optional<SpelInterpolation> interpolation = interpolatedName(word);
		if (interpolation.isPresent()) {
			return interpolation.get();
		}
		Optional<SpelText> name = plainName(word);
		if (!name.isPresent()) {
			throw new SpelSyntaxException("objects in function arguments have to be interpolated. try `${" + word + "}`");
		}
		Optional<SpelElement> keyword = keyword(name.get());
		if (keyword.isPresent()) {
			return (SpelArgument) keyword.get();
		}
		String interpolated = "${" + name.get().getContent() + "}";
		throw new SpelSyntaxException("objects in arguments have to be interpolated. try `" + interpolated + "`",
				SpelSyntaxFix.replace(name.get().getLocation(), interpolated));
	}

	/**
	 * @return the literal a plain name stands for, if it is one of <code>true</code>, <code>false</code> or
	 * <code>null</code>
	 */
	private static Optional<SpelElement> keyword(SpelText name) {
		switch (name.getContent()) {
			case "true":
				return Optional.of(new SpelBoolean(true, name.getLocation()));
			case "false":
				return Optional.of(new SpelBoolean(false, name.getLocation()));
			case "null":
				return Optional.of(new SpelNull(name.getLocation()));
			default:
				return Optional.empty();
		}
	}

	// numbers

	private SpelNumber parseNumber() throws SpelSyntaxException {
		int start = scanner.getCursor();
		StringBuilder result = new StringBuilder(parseInteger());
		if (scanner.peekIs('.')) {
			scanner.pop();
			result.append('.').append(parseInteger());
		}
		if (scanner.peekIs('e') || scanner.peekIs('E')) {
			result.append(scanner.pop().get());
			if (scanner.peekIs('-') || scanner.peekIs('+')) {
				result.append(scanner.pop().get());
			}
			result.append(parseInteger());
		}
		return new SpelNumber(result.toString(), SpelLocation.variable(start, scanner.getCursor() - start));
	}

	private String parseInteger() throws SpelSyntaxException {
		Optional<Character> first = scanner.pop();
		if (!first.isPresent()) {
			throw unexpectedEnd();
		}
		if (!isDigit(first.get())) {
			throw new SpelSyntaxException("expected number, found \"" + first.get() + "\"");
		}
		StringBuilder result = new StringBuilder().append(first.get());
		while (!scanner.isDone() && isDigit(scanner.peek().get())) {
			result.append(scanner.pop().get());
		}
		return result.toString();
	}

	// expressions

	private SpelExpression parseExpression() throws SpelSyntaxException {
		SpelComparable content = parseUndecidedContent();
		scanner.skipWhitespace();
		return toExpression(resolveUndecidedContent(content));
	}

	/**
	 * Parses an operand of a binary operation. Comparisons and conditions are left to the caller so that they bind
	 * looser than any arithmetic operator.
	 */
	private SpelExpression parseArithmetic() throws SpelSyntaxException {
		SpelComparable content = parseUndecidedContent();
		scanner.skipWhitespace();
		return tryParseBinaryOperation(toExpression(content));
	}

	private static SpelExpression toExpression(SpelComparable content) throws SpelSyntaxException {
		if (content instanceof SpelExpression) {
			return (SpelExpression) content;
		}
		throw new SpelSyntaxException("unexpected " + content.typeName());
	}

	/**
	 * Parses the first operand of something that may turn out to be an expression or a condition. Plain names have
	 * to be interpolated here.
	 */
	private SpelComparable parseUndecidedContent() throws SpelSyntaxException {
		Optional<Character> next = scanner.peek();
		if (!next.isPresent()) {
			throw unexpectedEnd();
		}
		char c = next.get();
		switch (c) {
			case '\'':
				return parseString();
			case '$':
				return parseInterpolation();
			case '(':
				return parseBracketedContent();
			case '+':
			case '-':
				return parseSignedExpression();
			case '!':
				return parseNegatedCondition();
			default:
				if (isDigit(c)) {
					return parseNumber();
				}
		}
		int start = scanner.getCursor();
		SpelObject object = parseNameOrGlobalFunction();
		if (object instanceof SpelFunction) {
			return (SpelFunction) object;
		}
		SpelWord word = (SpelWord) object;
		Optional<SpelInterpolation> interpolation = interpolatedName(word);
		if (interpolation.isPresent()) {
			return interpolation.get();
		}
		Optional<SpelText> name = plainName(word);
		if (name.isPresent()) {
			Optional<SpelElement> keyword = keyword(name.get());
			if (keyword.isPresent()) {
				return (SpelComparable) keyword.get();
			}
		}
		String interpolated = "${" + word + "}";
		throw new SpelSyntaxException("objects in expressions have to be interpolated. try `" + interpolated + "`",
				SpelSyntaxFix.replace(SpelLocation.variable(start, word.getEndCharacter() - start), interpolated));
	}

	/**
	 * Extends content with whatever operators follow it until the result cannot be extended any further.
	 */
	private SpelComparable resolveUndecidedContent(SpelComparable content) throws SpelSyntaxException {
		if (content instanceof SpelInterpolation || content instanceof SpelFunction) {
			SpelExpression expression = tryParseBinaryOperation((SpelExpression) content);
			if (expression != content) {
				return resolveUndecidedContent(expression);
			}
			Optional<SpelComparison> comparison = tryParseComparison(content);
			if (comparison.isPresent()) {
				return resolveUndecidedContent(resolveComparable(comparison.get()));
			}
			return resolveCondition((SpelCondition) content);
		}
		if (content instanceof SpelNull || content instanceof SpelString) {
			Optional<SpelComparison> comparison = tryParseComparison(content);
			if (comparison.isPresent()) {
				return resolveUndecidedContent(resolveComparable(comparison.get()));
			}
			return content;
		}
		if (content instanceof SpelCondition) {
			Optional<SpelComparison> comparison = tryParseComparison(content);
			if (comparison.isPresent()) {
				return resolveUndecidedContent(resolveComparable(comparison.get()));
			}
			return resolveCondition((SpelCondition) content);
		}
		SpelExpression expression = tryParseBinaryOperation((SpelExpression) content);
		Optional<SpelComparison> comparison = tryParseComparison(expression);
		if (comparison.isPresent()) {
			return resolveUndecidedContent(resolveComparable(comparison.get()));
		}
		return expression;
	}

	private SpelComparable resolveCondition(SpelCondition condition) throws SpelSyntaxException {
		Optional<SpelBinaryCondition> binary = tryParseBinaryCondition(condition);
		if (binary.isPresent()) {
			return resolveUndecidedContent(binary.get());
		}
		Optional<SpelTernary> ternary = tryParseTernary(condition);
		if (ternary.isPresent()) {
			return resolveUndecidedContent(ternary.get());
		}
		return condition;
	}

	private SpelComparable parseBracketedContent() throws SpelSyntaxException {
		SpelLocation openingBracketLocation = SpelLocation.single(scanner.getCursor());
		if (!scanner.take('(')) {
			throw new SpelSyntaxException("expected opening bracket");
		}
		scanner.skipWhitespace();
		SpelComparable content = parseUndecidedContent();
		scanner.skipWhitespace();
		content = resolveUndecidedContent(content);
		scanner.skipWhitespace();
		if (!scanner.take(')')) {
			throw new SpelSyntaxException("unclosed bracket. try adding it", SpelSyntaxFix.insert(scanner.getCursor(), ")"));
		}
		SpelLocation closingBracketLocation = SpelLocation.single(scanner.getCursor() - 1);
		if (content instanceof SpelString) {
			throw new SpelSyntaxException("unsupported brackets around \"" + content.typeName() + "\"");
		}
		if (content instanceof SpelCondition && !(content instanceof SpelInterpolation || content instanceof SpelFunction)) {
			return new SpelBracketedCondition((SpelCondition) content, openingBracketLocation, closingBracketLocation);
		}
		return new SpelBracketedExpression((SpelExpression) content, openingBracketLocation, closingBracketLocation);
	}

	/**
	 * A sign applies to the operand right after it, so <code>-1 + 2</code> adds 2 to -1.
	 */
	private SpelSignedExpression parseSignedExpression() throws SpelSyntaxException {
		SpelLocation signLocation = SpelLocation.single(scanner.getCursor());
		Optional<Character> next = scanner.pop();
		if (!next.isPresent()) {
			throw unexpectedEnd();
		}
		SpelSign sign;
		if (next.get() == '+') {
			sign = SpelSign.PLUS;
		} else if (next.get() == '-') {
			sign = SpelSign.MINUS;
		} else {
			throw unexpectedChar(next.get());
		}
		scanner.skipWhitespace();
		if (scanner.peekIs('+') || scanner.peekIs('-')) {
			throw new SpelSyntaxException("duplicate sign");
		}
		SpelExpression operand = toExpression(parseUndecidedContent());
		return new SpelSignedExpression(sign, signLocation, operand);
	}

	private SpelExpression tryParseBinaryOperation(SpelExpression left) throws SpelSyntaxException {
		Optional<SpelExpressionOperator> operator = scanner.transform(SpelExpressionOperator::fromSymbol);
		if (!operator.isPresent()) {
			return left;
		}
		SpelLocation operatorLocation = SpelLocation.single(scanner.getCursor() - 1);
		scanner.skipWhitespace();
		SpelExpression right = parseArithmetic();
		return resolvePrecedence(left, operator.get(), right, operatorLocation);
	}

	/**
	 * Right hand sides are parsed greedily, which leans the tree to the right. Where the operator in front binds at
	 * least as tight as the top operator of the right hand side, the tree is rotated to the left.
	 */
	private static SpelExpression resolvePrecedence(SpelExpression left, SpelExpressionOperator operator,
	                                                SpelExpression right, SpelLocation operatorLocation) {
		if (right instanceof SpelBinaryExpression) {
			SpelBinaryExpression binary = (SpelBinaryExpression) right;
			if (operator.bindsAtLeastAsTightAs(binary.getOperator())) {
				return new SpelBinaryExpression(
						resolvePrecedence(left, operator, binary.getLeft(), operatorLocation),
						binary.getOperator(),
						binary.getRight(),
						binary.getOperatorLocation());
			}
		}
		return new SpelBinaryExpression(left, operator, right, operatorLocation);
	}

	private Optional<SpelTernary> tryParseTernary(SpelCondition condition) throws SpelSyntaxException {
		if (!scanner.take('?')) {
			return Optional.empty();
		}
		SpelLocation questionMarkLocation = SpelLocation.single(scanner.getCursor() - 1);
		scanner.skipWhitespace();
		SpelExpression left = parseExpression();
		if (!scanner.take(':')) {
			throw new SpelSyntaxException("incomplete ternary; missing `:`. try adding it",
					SpelSyntaxFix.insert(scanner.getCursor(), " : 0"));
		}
		SpelLocation colonLocation = SpelLocation.single(scanner.getCursor() - 1);
		scanner.skipWhitespace();
		SpelExpression right = parseExpression();
		return Optional.of(new SpelTernary(condition, left, right, questionMarkLocation, colonLocation));
	}

	// conditions

	private SpelCondition parseCondition() throws SpelSyntaxException {
		return resolveComparable(parseComparable(true));
	}

	/**
	 * @param allowReferences whether plain object names like <code>_a.b</code> are accepted as operands
	 */
	private SpelComparable parseComparable(boolean allowReferences) throws SpelSyntaxException {
		Optional<Character> next = scanner.peek();
		if (!next.isPresent()) {
			throw unexpectedEnd();
		}
		char c = next.get();
		if (c == '\'') {
			return parseString();
		}
		if (c == '$') {
			SpelInterpolation interpolation = parseInterpolation();
			scanner.skipWhitespace();
			return tryParseBinaryOperation(interpolation);
		}
		if (c == '+' || c == '-') {
			SpelExpression expression = parseSignedExpression();
			scanner.skipWhitespace();
			return tryParseBinaryOperation(expression);
		}
		if (isDigit(c)) {
			SpelNumber number = parseNumber();
			scanner.skipWhitespace();
			return tryParseBinaryOperation(number);
		}
		if (c == '(') {
			SpelComparable bracketed = parseBracketedComparable();
			if (bracketed instanceof SpelBracketedExpression) {
				scanner.skipWhitespace();
				return tryParseBinaryOperation((SpelExpression) bracketed);
			}
			return bracketed;
		}
		if (c == '!') {
			return parseNegatedCondition();
		}
		int start = scanner.getCursor();
		SpelObject object = parseNameOrGlobalFunction();
		if (object instanceof SpelFunction) {
			return object;
		}
		SpelWord word = (SpelWord) object;
		Optional<SpelInterpolation> interpolation = interpolatedName(word);
		if (interpolation.isPresent()) {
			scanner.skipWhitespace();
			return tryParseBinaryOperation(interpolation.get());
		}
		Optional<SpelText> name = plainName(word);
		if (name.isPresent()) {
			Optional<SpelElement> keyword = keyword(name.get());
			if (keyword.isPresent()) {
				return (SpelComparable) keyword.get();
			}
		}
		if (allowReferences) {
			return parseObjectAccess(word);
		}
		String interpolated = "${" + word + "}";
		throw new SpelSyntaxException("objects in comparissons have to be interpolated. try `" + interpolated + "`",
				SpelSyntaxFix.replace(SpelLocation.variable(start, word.getEndCharacter() - start), interpolated));
	}

	private SpelCondition resolveComparable(SpelComparable comparable) throws SpelSyntaxException {
		scanner.skipWhitespace();
		Optional<SpelComparison> comparison = tryParseComparison(comparable);
		if (comparison.isPresent()) {
			return resolveComparable(comparison.get());
		}
		SpelCondition condition = toCondition(comparable);
		Optional<SpelBinaryCondition> binary = tryParseBinaryCondition(condition);
		if (binary.isPresent()) {
			return resolveComparable(binary.get());
		}
		return condition;
	}

	private static SpelCondition toCondition(SpelComparable comparable) throws SpelSyntaxException {
		if (comparable instanceof SpelInterpolation || comparable instanceof SpelFunction) {
			return (SpelCondition) comparable;
		}
		if (comparable instanceof SpelNull) {
			throw new SpelSyntaxException("`null` is not a valid condition. did you mean `false`?",
					SpelSyntaxFix.replace(((SpelNull) comparable).getLocation(), "false"));
		}
		if (comparable instanceof SpelString) {
			throw new SpelSyntaxException("unexpected " + comparable.typeName());
		}
		if (comparable instanceof SpelCondition) {
			return (SpelCondition) comparable;
		}
		if (comparable instanceof SpelObject) {
			String interpolated = "${" + comparable + "}";
			throw new SpelSyntaxException("objects in conditions have to be interpolated. try `" + interpolated + "`",
					SpelSyntaxFix.replace(comparable.getLocation(), interpolated));
		}
		throw new SpelSyntaxException("unexpected " + comparable.typeName());
	}

	private Optional<SpelComparison> tryParseComparison(SpelComparable left) throws SpelSyntaxException {
		Optional<Character> next = scanner.peek();
		if (!next.isPresent()) {
			return Optional.empty();
		}
		char c = next.get();
		if (c != '!' && c != '=' && c != '>' && c != '<') {
			return Optional.empty();
		}
		scanner.pop();
		boolean equals = scanner.take('=');
		SpelComparisonOperator operator;
		if (c == '=' && equals) {
			operator = SpelComparisonOperator.EQUAL;
		} else if (c == '!' && equals) {
			operator = SpelComparisonOperator.UNEQUAL;
		} else if (c == '>') {
			operator = equals ? SpelComparisonOperator.GREATER_THAN_OR_EQUAL : SpelComparisonOperator.GREATER_THAN;
		} else if (c == '<') {
			operator = equals ? SpelComparisonOperator.LESS_THAN_OR_EQUAL : SpelComparisonOperator.LESS_THAN;
		} else {
			throw new SpelSyntaxException("`" + c + "` is not a valid comparisson operator. did you mean `" + c + "=`?",
					SpelSyntaxFix.insert(scanner.getCursor(), "="));
		}
		SpelLocation operatorLocation = equals
				? SpelLocation.pair(scanner.getCursor() - 2)
				: SpelLocation.single(scanner.getCursor() - 1);
		scanner.skipWhitespace();
		SpelComparable right = parseComparable(true);
		return Optional.of(new SpelComparison(left, operator, right, operatorLocation));
	}

	private Optional<SpelBinaryCondition> tryParseBinaryCondition(SpelCondition left) throws SpelSyntaxException {
		if (!scanner.peekIs('&') && !scanner.peekIs('|')) {
			return Optional.empty();
		}
		char first = scanner.peek().get();
		SpelConditionOperator operator = first == '&' ? SpelConditionOperator.AND : SpelConditionOperator.OR;
		SpelLocation operatorLocation = SpelLocation.pair(scanner.getCursor());
		scanner.pop();
		if (!scanner.take(first)) {
			throw new SpelSyntaxException(
					"`" + first + "` is not a valid condition operator. did you mean `" + first + first + "`?",
					SpelSyntaxFix.insert(scanner.getCursor(), String.valueOf(first)));
		}
		scanner.skipWhitespace();
		SpelCondition right = parseCondition();
		return Optional.of(new SpelBinaryCondition(left, operator, right, operatorLocation));
	}

	private SpelComparable parseBracketedComparable() throws SpelSyntaxException {
		SpelLocation openingBracketLocation = SpelLocation.single(scanner.getCursor());
		if (!scanner.take('(')) {
			throw new SpelSyntaxException("expected opening bracket");
		}
		scanner.skipWhitespace();
		SpelComparable comparable = parseComparable(true);
		scanner.skipWhitespace();
		Optional<Character> next = scanner.peek();
		if (next.isPresent() && "&|=!<>".indexOf(next.get()) >= 0) {
			comparable = resolveComparable(comparable);
			scanner.skipWhitespace();
		}
		next = scanner.pop();
		if (!next.isPresent()) {
			throw new SpelSyntaxException("unclosed bracket. try adding it", SpelSyntaxFix.insert(scanner.getCursor(), ")"));
		}
		if (next.get() != ')') {
			throw unexpectedChar(next.get());
		}
		SpelLocation closingBracketLocation = SpelLocation.single(scanner.getCursor() - 1);
		if (comparable instanceof SpelInterpolation || comparable instanceof SpelFunction
				|| comparable instanceof SpelNull || comparable instanceof SpelObject) {
			throw new SpelSyntaxException("unsupported brackets around \"" + comparable.typeName() + "\"");
		}
		if (comparable instanceof SpelCondition) {
			return new SpelBracketedCondition((SpelCondition) comparable, openingBracketLocation, closingBracketLocation);
		}
		return new SpelBracketedExpression((SpelExpression) comparable, openingBracketLocation, closingBracketLocation);
	}

	private SpelNegatedCondition parseNegatedCondition() throws SpelSyntaxException {
		SpelLocation exclamationMarkLocation = SpelLocation.single(scanner.getCursor());
		scanner.pop();
		scanner.skipWhitespace();
		SpelCondition condition = parseCondition();
		if (condition instanceof SpelNegatedCondition) {
			SpelLocation second = ((SpelNegatedCondition) condition).getExclamationMarkLocation();
			throw new SpelSyntaxException("doubly negated conditions are not supported. try removing the negations",
					SpelSyntaxFix.delete(SpelLocation.variable(exclamationMarkLocation.getCharacter(),
							second.getEndCharacter() - exclamationMarkLocation.getCharacter())));
		}
		return new SpelNegatedCondition(condition, exclamationMarkLocation);
	}

	/**
	 * @return the text this parser works on
	 */
	public String getText() {
		return text;
	}
}
