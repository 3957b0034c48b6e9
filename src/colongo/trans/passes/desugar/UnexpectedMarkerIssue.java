package colongo.trans.passes.desugar;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.util.SourceLocation;

/**
 * A colon-prefixed name outside the left-hand side of an assignment.
 */
public class UnexpectedMarkerIssue extends Issue {

	private final SourceLocation location;
	private final String name;

	public UnexpectedMarkerIssue(SourceLocation location, String name) {
		this.location = location;
		this.name = name;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
