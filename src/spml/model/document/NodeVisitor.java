package spml.model.document;

public abstract class NodeVisitor<T, E extends Throwable> {
	public abstract T visit(TagNode tagNode) throws E;
	public abstract T visit(HtmlNode htmlNode) throws E;
	public abstract T visit(TextNode textNode) throws E;
	public abstract T visit(ErrorNode errorNode) throws E;
}
