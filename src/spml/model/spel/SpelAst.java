package spml.model.spel;

import java.util.Objects;

/**
 * A parsed attribute value together with the grammar it was parsed with.
 */
public class SpelAst {
	private final SpelGrammar grammar;
	private final SpelResult<? extends SpelElement> result;

	public SpelAst(SpelGrammar grammar, SpelResult<? extends SpelElement> result) {
		this.grammar = grammar;
		this.result = result;
	}

	public SpelGrammar getGrammar() {
		return grammar;
	}

	public SpelResult<? extends SpelElement> getResult() {
		return result;
	}

	public boolean isValid() {
		return result.isValid();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelAst spelAst = (SpelAst) o;
		return grammar == spelAst.grammar && Objects.equals(result, spelAst.result);
	}

	@Override
	public int hashCode() {
		return Objects.hash(grammar, result);
	}

	@Override
	public String toString() {
		return grammar.name().toLowerCase() + ": " + result;
	}
}
