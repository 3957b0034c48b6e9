package colongo.formatters;

import colongo.model.golang.GoNode;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T param) throws IOException;
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> writer) throws IOException {
		boolean isFirst = true;
		for (T item : items) {
			if (!isFirst) {
				out.write(", ");
			}
			isFirst = false;
			writer.format(item);
		}
	}

	/**
	 * Prints a node as canonically formatted Go. A module is printed with its comments.
	 */
	public static String format(GoNode node) {
		StringWriter w = new StringWriter();
		GoSourceWriter out = new GoSourceWriter(w);
		try {
			node.accept(new GoNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return ColumnAligner.align(w.toString());
	}

}
