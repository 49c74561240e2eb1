package spml.model.spel;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A module relative path like <code>/a/${b}.spml</code>.
 */
public class SpelUriLiteral extends SpelNode implements SpelUri {
	private final List<SpelUriFragment> fragments;
	private final SpelUriFileExtension fileExtension;

	public SpelUriLiteral(List<SpelUriFragment> fragments, SpelUriFileExtension fileExtension) {
		this.fragments = fragments;
		this.fileExtension = fileExtension;
	}

	public List<SpelUriFragment> getFragments() {
		return fragments;
	}

	public Optional<SpelUriFileExtension> getFileExtension() {
		return Optional.ofNullable(fileExtension);
	}

	@Override
	public int getStartCharacter() {
		return fragments.isEmpty() ? 0 : fragments.get(0).getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return fileExtension != null ? fileExtension.getEndCharacter() : fragments.isEmpty() ? 0 : fragments.get(fragments.size() - 1).getEndCharacter();
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
		SpelUriLiteral that = (SpelUriLiteral) o;
		return Objects.equals(fragments, that.fragments) &&
				Objects.equals(fileExtension, that.fileExtension);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fragments, fileExtension);
	}
}
