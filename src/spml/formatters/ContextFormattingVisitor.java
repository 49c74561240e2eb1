package spml.formatters;

import spml.errors.ContextVisitor;
import spml.errors.InFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {
	private final IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(InFile inFile) throws IOException {
		out.write("in file ");
		out.write(inFile.getPath());
		return null;
	}
}
