package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * An identifier. The name is mutable so that marker encodings can be undone in place.
 */
public class GoVariableName extends GoExpression {

	private String name;

	public GoVariableName(SourceLocation location, String name) {
		super(location);
		this.name = name;
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
		GoVariableName that = (GoVariableName) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
