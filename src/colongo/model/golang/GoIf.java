package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * The if statement
 *
 */
public class GoIf extends GoStatement {
	private final GoStatement init;
	// boolean condition
	private final GoExpression cond;
	private final GoBlock bThen;
	// null, a GoBlock or another GoIf
	private final GoStatement bElse;

	public GoIf(SourceLocation location, GoStatement init, GoExpression cond, GoBlock bThen, GoStatement bElse) {
		super(location);
		this.init = init;
		this.cond = cond;
		this.bThen = bThen;
		this.bElse = bElse;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoExpression getCond() {
		return cond;
	}

	public GoBlock getThen() {
		return bThen;
	}

	public GoStatement getElse() {
		return bElse;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIf anIf = (GoIf) o;
		return Objects.equals(init, anIf.init) &&
				Objects.equals(cond, anIf.cond) &&
				Objects.equals(bThen, anIf.bThen) &&
				Objects.equals(bElse, anIf.bElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, cond, bThen, bElse);
	}
}
