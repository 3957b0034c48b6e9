package colongo.model.golang;

import colongo.model.golang.type.GoType;
import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * expression.(T), or expression.(type) in a type switch guard when the type is null.
 */
public class GoTypeAssertion extends GoExpression {

	private final GoExpression expression;
	private final GoType type;

	public GoTypeAssertion(SourceLocation location, GoExpression expression, GoType type) {
		super(location);
		this.expression = expression;
		this.type = type;
	}

	public GoExpression getExpression() {
		return expression;
	}

	public GoType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeAssertion that = (GoTypeAssertion) o;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, type);
	}
}
