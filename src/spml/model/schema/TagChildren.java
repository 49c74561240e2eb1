package spml.model.schema;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Which tags may appear in the body of a tag.
 */
public class TagChildren {
	public enum Kind {
		ANY,
		NONE,
		SCALAR,
		VECTOR,
	}

	private static final TagChildren ANY = new TagChildren(Kind.ANY, Collections.emptyList());
	private static final TagChildren NONE = new TagChildren(Kind.NONE, Collections.emptyList());

	private final Kind kind;
	private final List<String> tags;

	private TagChildren(Kind kind, List<String> tags) {
		this.kind = kind;
		this.tags = tags;
	}

	public static TagChildren any() {
		return ANY;
	}

	public static TagChildren none() {
		return NONE;
	}

	public static TagChildren scalar(String tag) {
		return new TagChildren(Kind.SCALAR, Collections.singletonList(tag));
	}

	public static TagChildren vector(List<String> tags) {
		return new TagChildren(Kind.VECTOR, Collections.unmodifiableList(tags));
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the names of the permitted tags, empty for {@link Kind#ANY} and {@link Kind#NONE}
	 */
	public List<String> getTags() {
		return tags;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TagChildren that = (TagChildren) o;
		return kind == that.kind && tags.equals(that.tags);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, tags);
	}

	@Override
	public String toString() {
		return kind == Kind.ANY || kind == Kind.NONE ? kind.toString() : kind + tags.toString();
	}
}
