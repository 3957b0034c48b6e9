package colongo.trans.passes.parse;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.parser.GoParseException;
import colongo.util.SourceLocation;

public class ParsingIssue extends Issue {
	private final GoParseException error;

	public ParsingIssue(GoParseException error) {
		initCause(error);
		this.error = error;
	}

	public GoParseException getError() {
		return error;
	}

	@Override
	public SourceLocation getLocation() {
		return error.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
