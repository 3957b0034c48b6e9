package colongo.util;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

public class OffsetMapTest {

	@Test
	public void testIdentity() {
		OffsetMap map = OffsetMap.identity();
		assertTrue(map.isIdentity());
		assertThat(map.toOriginal(0), is(0));
		assertThat(map.toOriginal(42), is(42));
	}

	@Test
	public void testInsertions() {
		// "ab" with "XY" inserted after "a" and "Z" after "b": "aXYbZ"
		OffsetMap map = new OffsetMap();
		map.recordInsertion(1, 2);
		map.recordInsertion(4, 1);
		assertFalse(map.isIdentity());
		assertThat(map.toOriginal(0), is(0));
		assertThat(map.toOriginal(1), is(1));
		assertThat(map.toOriginal(2), is(1));
		assertThat(map.toOriginal(3), is(1));
		assertThat(map.toOriginal(4), is(2));
		assertThat(map.toOriginal(5), is(2));
	}

	@Test
	public void testEmptyInsertionIsIgnored() {
		OffsetMap map = new OffsetMap();
		map.recordInsertion(3, 0);
		assertTrue(map.isIdentity());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInsertionsOutOfOrder() {
		OffsetMap map = new OffsetMap();
		map.recordInsertion(5, 2);
		map.recordInsertion(6, 1);
	}

	@Test
	public void testRemappedFileLocatesOriginalPositions() {
		OffsetMap map = new OffsetMap();
		map.recordInsertion(1, 2);
		SourceFile file = new SourceFile(Paths.get("TEST"), "a\nb").remapped(map);
		// "aXY\nb" as scanned
		SourceLocation location = file.locate(4, 5);
		assertThat(location.getStartLine(), is(2));
		assertThat(location.getStartColumn(), is(1));
		assertThat(location.getStartOffset(), is(2));
	}

}
