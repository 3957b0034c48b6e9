package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * expression.name
 */
public class GoSelectorExpression extends GoExpression {

	private final GoExpression expression;
	private String name;

	public GoSelectorExpression(SourceLocation location, GoExpression expression, String name) {
		super(location);
		this.expression = expression;
		this.name = name;
	}

	public GoExpression getExpression() {
		return expression;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSelectorExpression that = (GoSelectorExpression) o;
		return Objects.equals(expression, that.expression) &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression, name);
	}
}
