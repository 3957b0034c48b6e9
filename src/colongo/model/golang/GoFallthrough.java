package colongo.model.golang;

import colongo.util.SourceLocation;

public class GoFallthrough extends GoStatement {

	public GoFallthrough(SourceLocation location) {
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
		return GoFallthrough.class.hashCode();
	}
}
