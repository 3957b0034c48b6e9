package colongo.trans.passes.desugar;

import colongo.errors.Issue;
import colongo.errors.IssueVisitor;
import colongo.util.SourceLocation;

public class MixedAssignmentIssue extends Issue {

	public enum Position {
		INIT_STATEMENT,
		RANGE,
	}

	private final SourceLocation location;
	private final Position position;

	public MixedAssignmentIssue(SourceLocation location, Position position) {
		this.location = location;
		this.position = position;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public Position getPosition() {
		return position;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
