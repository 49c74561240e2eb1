package spml.model.document;

import java.util.Objects;

/**
 * Where a taglib import takes its tags from: a taglib uri or a directory of tag files.
 */
public abstract class TagLibOrigin {
	private final Parsed<PlainAttribute> attribute;

	TagLibOrigin(Parsed<PlainAttribute> attribute) {
		this.attribute = attribute;
	}

	public Parsed<PlainAttribute> getAttribute() {
		return attribute;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return attribute.equals(((TagLibOrigin) o).attribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getClass(), attribute);
	}

	public static final class Uri extends TagLibOrigin {
		public Uri(Parsed<PlainAttribute> attribute) {
			super(attribute);
		}
	}

	public static final class TagDir extends TagLibOrigin {
		public TagDir(Parsed<PlainAttribute> attribute) {
			super(attribute);
		}
	}
}
