package spml.errors;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(InFile inFile) throws E;

}
