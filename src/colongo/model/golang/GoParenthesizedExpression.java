package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoParenthesizedExpression extends GoExpression {

	private final GoExpression inner;

	public GoParenthesizedExpression(SourceLocation location, GoExpression inner) {
		super(location);
		this.inner = inner;
	}

	public GoExpression getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoParenthesizedExpression that = (GoParenthesizedExpression) o;
		return Objects.equals(inner, that.inner);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner);
	}
}
