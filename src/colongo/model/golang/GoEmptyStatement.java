package colongo.model.golang;

import colongo.util.SourceLocation;

/**
 * Only kept where a statement is required but none was written, as in a label directly
 * before a closing brace.
 */
public class GoEmptyStatement extends GoStatement {

	public GoEmptyStatement(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o != null && getClass() == o.getClass());
	}

	@Override
	public int hashCode() {
		return GoEmptyStatement.class.hashCode();
	}
}
