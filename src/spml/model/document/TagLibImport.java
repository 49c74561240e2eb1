package spml.model.document;

import spml.util.Position;
import spml.util.Ranged;
import spml.util.SingleLineSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * A taglib directive, "&lt;%@ taglib ... %&gt;".
 */
public class TagLibImport implements Ranged {
	private final SingleLineSpan openBracket;
	private final SingleLineSpan taglib;
	private final TagLibOrigin origin;
	private final Parsed<PlainAttribute> prefix;
	private final SingleLineSpan closeBracket;

	public TagLibImport(SingleLineSpan openBracket, SingleLineSpan taglib, TagLibOrigin origin,
	                    Parsed<PlainAttribute> prefix, SingleLineSpan closeBracket) {
		this.openBracket = openBracket;
		this.taglib = taglib;
		this.origin = origin;
		this.prefix = prefix;
		this.closeBracket = closeBracket;
	}

	public SingleLineSpan getOpenBracket() {
		return openBracket;
	}

	public SingleLineSpan getTaglib() {
		return taglib;
	}

	public Optional<TagLibOrigin> getOrigin() {
		return Optional.ofNullable(origin);
	}

	public Optional<Parsed<PlainAttribute>> getPrefix() {
		return Optional.ofNullable(prefix);
	}

	public SingleLineSpan getCloseBracket() {
		return closeBracket;
	}

	@Override
	public Position start() {
		return openBracket.start();
	}

	@Override
	public Position end() {
		return closeBracket.end();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TagLibImport that = (TagLibImport) o;
		return openBracket.equals(that.openBracket) && taglib.equals(that.taglib)
				&& Objects.equals(origin, that.origin) && Objects.equals(prefix, that.prefix)
				&& closeBracket.equals(that.closeBracket);
	}

	@Override
	public int hashCode() {
		return Objects.hash(openBracket, taglib, origin, prefix, closeBracket);
	}
}
