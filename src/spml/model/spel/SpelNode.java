package spml.model.spel;

import spml.formatters.IndentingWriter;
import spml.formatters.SpelFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

/**
 * The base class of every SPEL AST node. Nodes print back to the source form they describe.
 */
public abstract class SpelNode implements SpelElement {

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter out = new StringWriter();
		try {
			accept(new SpelFormattingVisitor(new IndentingWriter(out)));
		} catch (IOException e) {
			throw new RuntimeException("You should never get an IO error from a StringWriter", e);
		}
		return out.toString();
	}
}
