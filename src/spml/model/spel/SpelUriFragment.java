package spml.model.spel;

import java.util.Objects;

public class SpelUriFragment extends SpelNode {
	private final SpelLocation slashLocation;
	private final SpelWord content;

	public SpelUriFragment(SpelLocation slashLocation, SpelWord content) {
		this.slashLocation = slashLocation;
		this.content = content;
	}

	public SpelLocation getSlashLocation() {
		return slashLocation;
	}

	public SpelWord getContent() {
		return content;
	}

	@Override
	public int getStartCharacter() {
		return slashLocation.getCharacter();
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
		SpelUriFragment that = (SpelUriFragment) o;
		return Objects.equals(slashLocation, that.slashLocation) &&
				Objects.equals(content, that.content);
	}

	@Override
	public int hashCode() {
		return Objects.hash(slashLocation, content);
	}
}
