package spml.parser;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import spml.model.spel.SpelAst;
import spml.model.spel.SpelGrammar;
import spml.model.spel.SpelSource;
import spml.model.spel.SpelSyntaxError;
import spml.model.spel.SpelSyntaxFix;
import spml.util.Position;

import static spml.model.spel.SpelGrammar.*;
import static spml.model.spel.SpelLocation.*;
import static spml.model.spel.SpelSyntaxFix.*;

@RunWith(Parameterized.class)
public class SpelSyntaxErrorTest {

	private static List<SpelSyntaxFix> fixes(SpelSyntaxFix... fixes) {
		return Arrays.asList(fixes);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{EXPRESSION, "", "string is empty", fixes()},
				{CONDITION, "   ", "string is empty", fixes()},
				{REGEX, "", "string is empty", fixes()},
				{QUERY, "", "string is empty", fixes()},
				{OBJECT, "${_x", "unclosed interpolation. try adding the missing bracket", fixes()},
				{EXPRESSION, "${a} b", "trailing \"b\". try removing it", fixes(delete(variable(4, 2)))},
				{URI, "/a.b.c", "trailing \".c\". try removing it", fixes(delete(variable(4, 2)))},
				{IDENTIFIER, "a b", "trailing \"b\". try removing it", fixes(delete(variable(1, 2)))},
				{EXPRESSION, "(1 + 2", "unclosed bracket. try adding it", fixes(insert(6, ")"))},
				{OBJECT, "'abc", "missing qoute. try adding adding it", fixes(insert(4, "'"))},
				{OBJECT, "'a\\", "missing qoute. try adding adding it", fixes(insert(3, "\\'"))},
				{OBJECT, "'a\\qb'", "invalid escape sequence `\\q`. did you mean `\\\\`?", fixes(insert(4, "\\"))},
				{OBJECT, "'ä'", "invalid character \"ä\"", fixes()},
				{OBJECT, "!a", "expected `{` after `!` for an interpolated anchor. try adding it", fixes(insert(1, "{"))},
				{OBJECT, "!{a", "unclosed anchor interpolation. try adding the missing bracket", fixes(insert(3, "}"))},
				{OBJECT, "a[1", "unclosed array access. try adding the missing bracket", fixes(insert(3, "]"))},
				{OBJECT, "#", "unexpected char \"#\"", fixes()},
				{EXPRESSION, "a + 1", "objects in expressions have to be interpolated. try `${a}`",
						fixes(replace(variable(0, 1), "${a}"))},
				{EXPRESSION, "1 +", "unexpected end", fixes()},
				{EXPRESSION, "--1", "duplicate sign", fixes()},
				{EXPRESSION, "1.x", "expected number, found \"x\"", fixes()},
				{EXPRESSION, "'a' == 'b'", "unexpected condition", fixes()},
				{EXPRESSION, "${a} ? 1", "incomplete ternary; missing `:`. try adding it", fixes(insert(8, " : 0"))},
				{EXPRESSION, "fn(1,", "unclosed function arguments. try adding the missing bracket",
						fixes(replace(single(4), ")"))},
				{EXPRESSION, "fn(1", "unclosed function arguments. try adding the missing bracket",
						fixes(insert(4, ")"))},
				{EXPRESSION, "fn(a)", "objects in arguments have to be interpolated. try `${a}`",
						fixes(replace(variable(3, 1), "${a}"))},
				{EXPRESSION, "fn(1 2)", "unexpected char \"2\"", fixes()},
				{CONDITION, "null", "`null` is not a valid condition. did you mean `false`?",
						fixes(replace(variable(0, 4), "false"))},
				{CONDITION, "1", "unexpected expression", fixes()},
				{CONDITION, "'a'", "unexpected string", fixes()},
				{CONDITION, "${a} = 1", "`=` is not a valid comparisson operator. did you mean `==`?",
						fixes(insert(6, "="))},
				{CONDITION, "${a} & ${b}", "`&` is not a valid condition operator. did you mean `&&`?",
						fixes(insert(6, "&"))},
				{CONDITION, "!!${a}", "doubly negated conditions are not supported. try removing the negations",
						fixes(delete(variable(0, 2)))},
				{CONDITION, "_a", "objects in conditions have to be interpolated. try `${_a}`",
						fixes(replace(variable(0, 2), "${_a}"))},
				{CONDITION, "(${a})", "unsupported brackets around \"object\"", fixes()},
		});
	}

	private final SpelGrammar grammar;
	private final String text;
	private final String message;
	private final List<SpelSyntaxFix> proposedFixes;

	public SpelSyntaxErrorTest(SpelGrammar grammar, String text, String message, List<SpelSyntaxFix> proposedFixes) {
		this.grammar = grammar;
		this.text = text;
		this.message = message;
		this.proposedFixes = proposedFixes;
	}

	@Test
	public void test() {
		SpelAst ast = SpelParser.parse(grammar, text);
		assertFalse(ast.isValid());
		SpelSyntaxError error = ast.getResult().getError().get();
		assertThat(error.getMessage(), is(message));
		assertThat(error.getProposedFixes(), is(proposedFixes));
	}

	@Test
	public void fixesStayInsideText() {
		SpelSyntaxError error = SpelParser.parse(grammar, text).getResult().getError().get();
		for (SpelSyntaxFix fix : error.getProposedFixes()) {
			assertTrue(fix.getRange(new SpelSource(new Position(0, 0), text)).getEnd().getCharacter() <= text.length());
		}
	}

	@Test
	public void comparableRejectsPlainNames() {
		SpelSyntaxError error = new SpelParser("a").parseComparableAst().getError().get();
		assertThat(error.getMessage(), is("objects in comparissons have to be interpolated. try `${a}`"));
		assertThat(error.getProposedFixes(), is(Collections.singletonList(replace(variable(0, 1), "${a}"))));
	}
}
