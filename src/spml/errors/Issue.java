package spml.errors;

import spml.Unreachable;
import spml.formatters.IndentingWriter;
import spml.formatters.IssueFormattingVisitor;
import spml.util.Span;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Optional;

/**
 * A finding of the analyzer. Issues are thrown nowhere; they are collected into an {@link IssueContext}.
 */
@SuppressWarnings("serial")
public abstract class Issue extends Exception {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	/**
	 * @return the document region the issue is about, if it is about one
	 */
	public Optional<Span> getSpan() {
		return Optional.empty();
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
}
