package spml.errors;

import java.util.Objects;

/**
 * Issues found while analyzing one file.
 */
public class InFile extends Context {
	private final String path;

	public InFile(String path) {
		this.path = path;
	}

	public String getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return path.equals(((InFile) o).path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path);
	}
}
