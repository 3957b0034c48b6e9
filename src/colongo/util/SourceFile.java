package colongo.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The text of one input unit, used to turn scanner offsets into {@link SourceLocation}s.
 *
 * When the scanned text is a rewritten copy of the input, the attached {@link OffsetMap}
 * translates offsets back so that locations always point into what the user wrote.
 */
public class SourceFile {

	private final Path path;
	private final String text;
	private final int[] lineStarts;
	private final OffsetMap offsetMap;

	public SourceFile(Path path, String text) {
		this(path, text, OffsetMap.identity());
	}

	public SourceFile(Path path, String text, OffsetMap offsetMap) {
		this.path = path;
		this.text = text;
		this.offsetMap = offsetMap;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < text.length(); ++i) {
			if (text.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	public SourceFile remapped(OffsetMap offsetMap) {
		return new SourceFile(path, text, offsetMap);
	}

	public Path getPath() {
		return path;
	}

	public String getText() {
		return text;
	}

	public OffsetMap getOffsetMap() {
		return offsetMap;
	}

	/**
	 * @param startOffset start of the span, in scanned coordinates
	 * @param endOffset end of the span (exclusive), in scanned coordinates
	 */
	public SourceLocation locate(int startOffset, int endOffset) {
		int start = offsetMap.toOriginal(startOffset);
		int end = Integer.max(start, offsetMap.toOriginal(endOffset));
		int startLine = lineOf(start);
		int endLine = lineOf(end);
		return new SourceLocation(
				path, start, end,
				startLine, endLine,
				start - lineStarts[startLine - 1] + 1, end - lineStarts[endLine - 1] + 1);
	}

	/**
	 * @return the 1-based line containing the original offset
	 */
	public int lineOf(int offset) {
		int low = 0;
		int high = lineStarts.length - 1;
		while (low < high) {
			int mid = (low + high + 1) / 2;
			if (lineStarts[mid] <= offset) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return low + 1;
	}

}
