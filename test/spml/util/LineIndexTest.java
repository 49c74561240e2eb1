package spml.util;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import org.junit.Test;

public class LineIndexTest {
	private final LineIndex index = new LineIndex("ab\r\ncd\n\nef");

	@Test
	public void positions() {
		assertThat(index.lineCount(), is(4));
		assertThat(index.positionOf(0), is(new Position(0, 0)));
		assertThat(index.positionOf(4), is(new Position(1, 0)));
		assertThat(index.positionOf(7), is(new Position(2, 0)));
		assertThat(index.positionOf(10), is(new Position(3, 2)));
	}

	@Test
	public void offsets() {
		assertThat(index.offsetOf(new Position(1, 1)), is(5));
		// clamped to the end of the line
		assertThat(index.offsetOf(new Position(0, 50)), is(2));
		assertThat(index.offsetOf(new Position(9, 0)), is(10));
	}

	@Test
	public void lineEndsExcludeLineBreaks() {
		assertThat(index.lineEnd(0), is(2));
		assertThat(index.lineEnd(1), is(6));
		assertThat(index.lineEnd(2), is(7));
		assertThat(index.lineEnd(3), is(10));
	}

	@Test
	public void textOf() {
		assertThat(index.textOf(new SingleLineSpan(1, 0, 2)), is("cd"));
		assertThat(index.textOf(new MultiLineSpan(0, 1, 1, 1)), is("b\r\nc"));
	}

	@Test(expected = IndexOutOfBoundsException.class)
	public void offsetOutsideText() {
		index.positionOf(11);
	}
}
