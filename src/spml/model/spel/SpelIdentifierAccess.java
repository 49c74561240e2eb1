package spml.model.spel;

import java.util.Objects;

/**
 * <code>identifier.field</code>
 */
public class SpelIdentifierAccess extends SpelNode implements SpelIdentifier {
	private final SpelIdentifier identifier;
	private final SpelWord field;
	private final SpelLocation dotLocation;

	public SpelIdentifierAccess(SpelIdentifier identifier, SpelWord field, SpelLocation dotLocation) {
		this.identifier = identifier;
		this.field = field;
		this.dotLocation = dotLocation;
	}

	public SpelIdentifier getIdentifier() {
		return identifier;
	}

	public SpelWord getField() {
		return field;
	}

	public SpelLocation getDotLocation() {
		return dotLocation;
	}

	@Override
	public int getStartCharacter() {
		return identifier.getStartCharacter();
	}

	@Override
	public int getEndCharacter() {
		return field.getEndCharacter();
	}

	@Override
	public String typeName() {
		return "identifier";
	}

	@Override
	public <T, E extends Throwable> T accept(SpelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelIdentifierAccess that = (SpelIdentifierAccess) o;
		return Objects.equals(identifier, that.identifier) &&
				Objects.equals(field, that.field) &&
				Objects.equals(dotLocation, that.dotLocation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(identifier, field, dotLocation);
	}
}
