package colongo.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that starts every line with the current indentation. Lines end with "\n" and indentation
 * is written lazily, so empty lines carry no trailing whitespace.
 */
public class IndentingWriter extends Writer {

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	String indentUnit = "\t";
	int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int levels;

		public Indent(IndentingWriter writer, int levels) {
			this.writer = writer;
			this.levels = levels;
		}

		@Override
		public void close() {
			writer.unindent(levels);
		}

	}

	/**
	 * @param levels how many indentation units to add; negative values indent less than the
	 *               surrounding text, as Go labels are
	 */
	public Indent indent(int levels) {
		if (indent + levels < 0) {
			throw new RuntimeException("can't indent below 0");
		}
		indent += levels;
		return new Indent(this, levels);
	}

	public Indent indent() {
		return indent(1);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}

	public int getIndentation() {
		return indent;
	}

	public void unindent(int levels) {
		if (levels > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= levels;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public IndentingWriter(Writer out, String indentUnit) {
		this.out = out;
		this.indentUnit = indentUnit;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write("\n");
	}

	/**
	 * Writes text whose line structure must survive as is, such as a raw string or a block comment:
	 * lines after the first are not indented.
	 */
	public void writeVerbatim(String data) throws IOException {
		if (shouldIndent) {
			writeIndentation();
		}
		out.write(data);
		int lastLine = data.lastIndexOf('\n');
		if (lastLine == -1) {
			horizontalPosition += data.length();
		} else {
			horizontalPosition = data.length() - lastLine - 1;
		}
	}

	private void writeIndentation() throws IOException {
		for (int i = 0; i < indent; ++i) {
			out.write(indentUnit);
		}
		shouldIndent = false;
		horizontalPosition = indent * indentUnit.length();
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			int next = data.indexOf('\n', start);
			if (shouldIndent && next != start) {
				writeIndentation();
			}
			if (next != -1) {
				out.write(data.substring(start, next + 1));
				start = next + 1;
				shouldIndent = true;
				horizontalPosition = 0;
			} else {
				horizontalPosition += data.length() - start;
				out.write(data.substring(start));
				break;
			}
		}
	}

}
