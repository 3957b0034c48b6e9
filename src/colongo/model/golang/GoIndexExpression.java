package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoIndexExpression extends GoExpression {

	private final GoExpression target;
	private final GoExpression index;

	public GoIndexExpression(SourceLocation location, GoExpression target, GoExpression index) {
		super(location);
		this.target = target;
		this.index = index;
	}

	public GoExpression getTarget() {
		return target;
	}

	public GoExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIndexExpression that = (GoIndexExpression) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(index, that.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, index);
	}
}
