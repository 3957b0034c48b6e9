package colongo.formatters;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class ColumnAlignerTest {

	private static final String B = ColumnAligner.CELL_BREAK;

	@Test
	public void testTextWithoutCellsIsUnchanged() {
		assertThat(ColumnAligner.align("a\n\tb\n"), is("a\n\tb\n"));
	}

	@Test
	public void testAdjacentLinesShareColumns() {
		assertThat(ColumnAligner.align("a" + B + "b\nccc" + B + "d"), is("a   b\nccc d"));
	}

	@Test
	public void testLineWithoutCellEndsBlock() {
		assertThat(ColumnAligner.align("a" + B + "1\nplain\nbbb" + B + "2"), is("a 1\nplain\nbbb 2"));
	}

	@Test
	public void testIndentationEndsBlock() {
		assertThat(ColumnAligner.align("\ta" + B + "x\nbb" + B + "y"), is("\ta x\nbb y"));
	}

	@Test
	public void testEmptyColumnsTakeNoSpace() {
		assertThat(ColumnAligner.align(B + "x\n" + B + "y"), is("x\ny"));
	}

}
