package colongo.trans.passes.rewrite;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.util.SourceLocation;

/**
 * The declare-and-assign operator appeared in the input. It is reserved for code the
 * translator generates; declarations are written with colon-prefixed names instead.
 */
public class ReservedOperatorIssue extends Issue {

	private final SourceLocation location;

	public ReservedOperatorIssue(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
