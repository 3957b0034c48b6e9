package colongo.formatters;

import colongo.model.golang.GoComment;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * An {@link IndentingWriter} that puts a module's comments back between the nodes being printed and
 * keeps single blank lines where the source had them.
 *
 * Nodes are announced with {@link #beginNode} once the writer sits at the start of their line, and
 * closed with {@link #endNode} once their line is complete. Comments that start before a node are
 * written on their own lines ahead of it; comments on the last line of a node are appended to that
 * line, separated by a cell break so that {@link ColumnAligner} can line them up. Nodes without a
 * known location are printed without any of this.
 */
public class GoSourceWriter extends IndentingWriter {

	private final Deque<GoComment> comments = new ArrayDeque<>();
	// the last line of the source that has been accounted for in the output
	private int lastLine = 0;

	public GoSourceWriter(Writer out) {
		super(out);
	}

	public void queueComments(List<GoComment> moduleComments) {
		List<GoComment> sorted = new ArrayList<>(moduleComments);
		sorted.sort(Comparator.comparing(GoComment::getLocation));
		comments.addAll(sorted);
	}

	public int getLastLine() {
		return lastLine;
	}

	public void setLastLine(int lastLine) {
		this.lastLine = lastLine;
	}

	public void writeCellBreak() throws IOException {
		write(ColumnAligner.CELL_BREAK);
	}

	public void beginNode(SourceLocation location) throws IOException {
		beginNode(location, false);
	}

	/**
	 * @param separate whether a blank line must precede the node and its leading comments
	 */
	public void beginNode(SourceLocation location, boolean separate) throws IOException {
		if (location.isUnknown()) {
			return;
		}
		boolean first = true;
		while (!comments.isEmpty() && comments.peekFirst().getLocation().getStartOffset() < location.getStartOffset()) {
			GoComment comment = comments.pollFirst();
			if ((first && separate) || startsAfterGap(comment.getLocation().getStartLine())) {
				newLine();
			}
			first = false;
			writeVerbatim(comment.getText());
			newLine();
			lastLine = comment.getLocation().getEndLine();
		}
		if ((first && separate) || startsAfterGap(location.getStartLine())) {
			newLine();
		}
		lastLine = Integer.max(lastLine, location.getStartLine());
	}

	public void endNode(SourceLocation location) throws IOException {
		endNode(location, 0);
	}

	/**
	 * @param extraTabs how many empty cells to write before a trailing comment, so that comments
	 *                  line up after aligned columns the node left empty
	 */
	public void endNode(SourceLocation location, int extraTabs) throws IOException {
		if (location.isUnknown()) {
			return;
		}
		trailingComments(location.getEndLine(), extraTabs);
	}

	/**
	 * Appends the comments that start on or before the given line to the current line.
	 */
	public void trailingComments(int line) throws IOException {
		trailingComments(line, 0);
	}

	private void trailingComments(int line, int extraTabs) throws IOException {
		boolean first = true;
		while (!comments.isEmpty() && comments.peekFirst().getLocation().getStartLine() <= line) {
			GoComment comment = comments.pollFirst();
			if (first) {
				for (int i = 0; i < extraTabs; ++i) {
					writeCellBreak();
				}
				writeCellBreak();
			} else {
				write(" ");
			}
			first = false;
			writeVerbatim(comment.getText());
			lastLine = Integer.max(lastLine, comment.getLocation().getEndLine());
		}
		lastLine = Integer.max(lastLine, line);
	}

	/**
	 * Writes the comments that precede a closing token at the given location, each on its own line.
	 * The writer is left at the end of the last line written.
	 */
	public void flushCommentsBefore(SourceLocation closing) throws IOException {
		if (closing.isUnknown()) {
			return;
		}
		int closeOffset = closing.getEndOffset() - 1;
		while (!comments.isEmpty() && comments.peekFirst().getLocation().getStartOffset() < closeOffset) {
			GoComment comment = comments.pollFirst();
			newLine();
			if (startsAfterGap(comment.getLocation().getStartLine())) {
				newLine();
			}
			writeVerbatim(comment.getText());
			lastLine = comment.getLocation().getEndLine();
		}
		if (startsAfterGap(closing.getEndLine())) {
			newLine();
		}
	}

	/**
	 * Writes every comment not printed yet, each on its own line.
	 */
	public void flushRemainingComments() throws IOException {
		while (!comments.isEmpty()) {
			GoComment comment = comments.pollFirst();
			newLine();
			if (startsAfterGap(comment.getLocation().getStartLine())) {
				newLine();
			}
			writeVerbatim(comment.getText());
			lastLine = comment.getLocation().getEndLine();
		}
	}

	/**
	 * @return whether a comment that is not yet printed lies inside the given span
	 */
	public boolean hasCommentsWithin(SourceLocation location) {
		if (location.isUnknown()) {
			return false;
		}
		for (GoComment comment : comments) {
			int offset = comment.getLocation().getStartOffset();
			if (offset >= location.getEndOffset()) {
				return false;
			}
			if (offset >= location.getStartOffset()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return whether the node is directly preceded by a comment, which documents it
	 */
	public boolean hasDocComment(SourceLocation location) {
		if (location.isUnknown()) {
			return false;
		}
		GoComment last = null;
		for (GoComment comment : comments) {
			if (comment.getLocation().getStartOffset() >= location.getStartOffset()) {
				break;
			}
			last = comment;
		}
		return last != null && last.getLocation().getEndLine() == location.getStartLine() - 1;
	}

	private boolean startsAfterGap(int line) {
		return lastLine > 0 && line > lastLine + 1;
	}

}
