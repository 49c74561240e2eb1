package spml.model.spel;

import spml.util.LineIndex;
import spml.util.Position;
import spml.util.Span;

import java.util.Objects;

/**
 * A SPEL text together with where it sits in its document. Locations inside the text are character offsets;
 * this maps them to document positions, moving to the following lines after every line break of the text.
 */
public class SpelSource {
	private final Position origin;
	private final LineIndex lines;

	/**
	 * @param origin the document position of the first character of text
	 * @param text   the attribute value exactly as it appears in the document
	 */
	public SpelSource(Position origin, String text) {
		this.origin = origin;
		this.lines = new LineIndex(text);
	}

	public Position getOrigin() {
		return origin;
	}

	public String getText() {
		return lines.getText();
	}

	/**
	 * Offsets past the end of the text continue the last line.
	 */
	public Position positionOf(int character) {
		int length = lines.getText().length();
		int overflow = Math.max(0, character - length);
		Position relative = lines.positionOf(Math.max(0, character - overflow));
		if (relative.getLine() == 0) {
			return origin.offsetBy(0, relative.getCharacter() + overflow);
		}
		return new Position(origin.getLine() + relative.getLine(), relative.getCharacter() + overflow);
	}

	public Span spanOf(SpelLocation location) {
		return Span.between(positionOf(location.getCharacter()), positionOf(location.getEndCharacter()));
	}

	public Span spanOf(SpelElement element) {
		return spanOf(element.getLocation());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		SpelSource that = (SpelSource) o;
		return origin.equals(that.origin) && getText().equals(that.getText());
	}

	@Override
	public int hashCode() {
		return Objects.hash(origin, getText());
	}
}
