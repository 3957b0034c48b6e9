package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoIncDec extends GoStatement {

	private final boolean inc;
	private final GoExpression expression;

	public GoIncDec(SourceLocation location, boolean inc, GoExpression expression) {
		super(location);
		this.inc = inc;
		this.expression = expression;
	}

	public boolean isInc() {
		return inc;
	}

	public GoExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIncDec goIncDec = (GoIncDec) o;
		return inc == goIncDec.inc &&
				Objects.equals(expression, goIncDec.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inc, expression);
	}
}
