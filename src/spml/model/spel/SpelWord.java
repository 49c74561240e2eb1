package spml.model.spel;

import java.util.List;
import java.util.Objects;

/**
 * A name, possibly assembled from several interpolated fragments.
 */
public class SpelWord extends SpelNode implements SpelObject, SpelIdentifier {
	private final List<SpelWordFragment> fragments;

	public SpelWord(List<SpelWordFragment> fragments) {
		this.fragments = fragments;
	}

	public List<SpelWordFragment> getFragments() {
		return fragments;
	}

	@Override
	public int getStartCharacter() {
		return fragments.get(0).getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return fragments.get(fragments.size() - 1).getEndCharacter();
	}

	@Override
	public String typeName() {
		return "object";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelWord that = (SpelWord) o;
		return Objects.equals(fragments, that.fragments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fragments);
	}
}
