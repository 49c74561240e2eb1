package spml.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line it starts with the current indentation. Lines are always separated by
 * <code>\n</code> so that formatted output does not depend on the platform.
 */
public class IndentingWriter extends Writer {
	private static final char LINE_BREAK = '\n';

	private final Writer out;
	private final int defaultIndent;
	private int indent = 0;
	private boolean atLineStart = true;

	public static class Indent implements AutoCloseable {
		private final IndentingWriter writer;
		private final int spaces;

		Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}
	}

	public IndentingWriter(Writer out) {
		this(out, 2);
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	private void unindent(int spaces) {
		if (spaces > indent) {
			throw new IllegalStateException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public void newLine() throws IOException {
		write(LINE_BREAK);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		for (int i = offset; i < offset + len; i++) {
			char c = chars[i];
			if (atLineStart && c != LINE_BREAK) {
				for (int s = 0; s < indent; s++) {
					out.write(' ');
				}
				atLineStart = false;
			}
			out.write(c);
			if (c == LINE_BREAK) {
				atLineStart = true;
			}
		}
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
