package spml.model.spel;

import java.util.Objects;

public class SpelUriFileExtension extends SpelNode {
	private final SpelLocation dotLocation;
	private final SpelWord content;

	public SpelUriFileExtension(SpelLocation dotLocation, SpelWord content) {
		this.dotLocation = dotLocation;
		this.content = content;
	}

	public SpelLocation getDotLocation() {
		return dotLocation;
	}

	public SpelWord getContent() {
		return content;
	}

	@Override
	public int getStartCharacter() {
		return dotLocation.getCharacter();
	}

	@Override
	public int getEndCharacter() {
		return content.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "uri";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelUriFileExtension that = (SpelUriFileExtension) o;
		return Objects.equals(dotLocation, that.dotLocation) &&
				Objects.equals(content, that.content);
	}

	@Override
	public int hashCode() {
		return Objects.hash(dotLocation, content);
	}
}
