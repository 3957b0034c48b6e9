package colongo.formatters;

import java.util.ArrayList;
import java.util.List;

/**
 * Lines up the cells of consecutive lines, the way gofmt's tabwriter pass does.
 *
 * Printers end a cell by writing {@link #CELL_BREAK}. Each line is indented by its leading tabs
 * and then split into cells; all but the last cell of a line belong to a column. A column block is
 * a run of adjacent lines with the same indentation that all have a cell in that column, and every
 * cell in the block is padded with spaces to the widest cell plus one. Columns whose cells are all
 * empty take no space.
 */
public final class ColumnAligner {

	public static final String CELL_BREAK = "\u000b";

	private static final class Line {
		final String prefix;
		final List<String> cells;

		Line(String prefix, List<String> cells) {
			this.prefix = prefix;
			this.cells = cells;
		}
	}

	private final List<Line> lines = new ArrayList<>();
	private final StringBuilder out = new StringBuilder();

	private ColumnAligner(String text) {
		for (String line : text.split("\n", -1)) {
			int indent = 0;
			while (indent < line.length() && line.charAt(indent) == '\t') {
				++indent;
			}
			List<String> cells = new ArrayList<>();
			int start = indent;
			int next;
			while ((next = line.indexOf(CELL_BREAK, start)) != -1) {
				cells.add(line.substring(start, next));
				start = next + 1;
			}
			cells.add(line.substring(start));
			lines.add(new Line(line.substring(0, indent), cells));
		}
	}

	public static String align(String text) {
		if (!text.contains(CELL_BREAK)) {
			return text;
		}
		ColumnAligner aligner = new ColumnAligner(text);
		aligner.format(0, aligner.lines.size(), new ArrayList<>());
		return aligner.out.toString();
	}

	private static int width(String cell) {
		return cell.codePointCount(0, cell.length());
	}

	private void format(int line0, int line1, List<Integer> widths) {
		int column = widths.size();
		for (int i = line0; i < line1; ++i) {
			Line line = lines.get(i);
			if (column >= line.cells.size() - 1) {
				continue;
			}
			// a column block starts at this line
			writeLines(line0, i, widths);
			line0 = i;
			int width = 0;
			boolean discardable = true;
			for (; i < line1; ++i) {
				Line current = lines.get(i);
				if (column >= current.cells.size() - 1 || !current.prefix.equals(line.prefix)) {
					break;
				}
				int cellWidth = width(current.cells.get(column));
				width = Integer.max(width, cellWidth + 1);
				if (cellWidth > 0) {
					discardable = false;
				}
			}
			widths.add(discardable ? 0 : width);
			format(line0, i, widths);
			widths.remove(widths.size() - 1);
			line0 = i;
			// the line that ended the block may start the next one
			--i;
		}
		writeLines(line0, line1, widths);
	}

	private void writeLines(int line0, int line1, List<Integer> widths) {
		for (int i = line0; i < line1; ++i) {
			Line line = lines.get(i);
			out.append(line.prefix);
			for (int j = 0; j < line.cells.size(); ++j) {
				String cell = line.cells.get(j);
				out.append(cell);
				if (j < line.cells.size() - 1) {
					for (int pad = width(cell); pad < widths.get(j); ++pad) {
						out.append(' ');
					}
				}
			}
			if (i < lines.size() - 1) {
				out.append('\n');
			}
		}
	}

}
