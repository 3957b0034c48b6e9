package colongo.lexer;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.util.SourceLocation;

/**
 * Malformed input found while scanning: an illegal character, an unterminated literal or comment.
 */
public class LexerIssue extends Issue {

	private final SourceLocation location;
	private final String description;

	public LexerIssue(SourceLocation location, String description) {
		this.location = location;
		this.description = description;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
