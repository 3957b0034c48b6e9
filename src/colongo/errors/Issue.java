package colongo.errors;

import colongo.InternalCompilerError;
import colongo.formatters.IndentingWriter;
import colongo.formatters.IssueFormattingVisitor;
import colongo.trans.TranslationException;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends TranslationException {
	public Issue() {
		super("");
	}
	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			// a StringWriter never throws
			throw new InternalCompilerError(e);
		}
		return sw.getBuffer().toString();
	}

	/**
	 * @return where the problem is in the user's source, or an unknown location for
	 * problems that are not tied to one
	 */
	public SourceLocation getLocation() {
		return SourceLocation.unknown();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
