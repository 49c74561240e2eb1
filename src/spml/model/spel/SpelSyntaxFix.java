package spml.model.spel;

import spml.util.Position;
import spml.util.Range;

import java.util.Objects;

/**
 * A mechanical correction of a SPEL text, proposed alongside a {@link SpelSyntaxError}.
 */
public abstract class SpelSyntaxFix {

	/**
	 * @return the document range this fix replaces
	 */
	public abstract Range getRange(SpelSource source);

	public abstract String getNewText();

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	public static Insert insert(int character, String text) {
		return new Insert(character, text);
	}

	public static Delete delete(SpelLocation location) {
		return new Delete(location);
	}

	public static Replace replace(SpelLocation location, String text) {
		return new Replace(location, text);
	}

	public static class Insert extends SpelSyntaxFix {
		private final int character;
		private final String text;

		public Insert(int character, String text) {
			this.character = character;
			this.text = text;
		}

		public int getCharacter() {
			return character;
		}

		@Override
		public Range getRange(SpelSource source) {
			Position position = source.positionOf(character);
			return new Range(position, position);
		}

		@Override
		public String getNewText() {
			return text;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Insert insert = (Insert) o;
			return character == insert.character && Objects.equals(text, insert.text);
		}

		@Override
		public int hashCode() {
			return Objects.hash(character, text);
		}

		@Override
		public String toString() {
			return "insert \"" + text + "\" at " + character;
		}
	}

	public static class Delete extends SpelSyntaxFix {
		private final SpelLocation location;

		public Delete(SpelLocation location) {
			this.location = location;
		}

		public SpelLocation getLocation() {
			return location;
		}

		@Override
		public Range getRange(SpelSource source) {
			return source.spanOf(location).range();
		}

		@Override
		public String getNewText() {
			return "";
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Delete delete = (Delete) o;
			return Objects.equals(location, delete.location);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location);
		}

		@Override
		public String toString() {
			return "delete " + location;
		}
	}

	public static class Replace extends SpelSyntaxFix {
		private final SpelLocation location;
		private final String text;

		public Replace(SpelLocation location, String text) {
			this.location = location;
			this.text = text;
		}

		public SpelLocation getLocation() {
			return location;
		}

		@Override
		public Range getRange(SpelSource source) {
			return source.spanOf(location).range();
		}

		@Override
		public String getNewText() {
			return text;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Replace replace = (Replace) o;
			return Objects.equals(location, replace.location) && Objects.equals(text, replace.text);
		}

		@Override
		public int hashCode() {
			return Objects.hash(location, text);
		}

		@Override
		public String toString() {
			return "replace " + location + " with \"" + text + "\"";
		}
	}
}
