package colongo.model.golang;

import colongo.model.golang.type.GoType;
import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * a, b T = x, y
 *
 * The type may be null, and the value list empty.
 */
public class GoValueSpec extends GoNode {

	private final List<GoVariableName> names;
	private final GoType type;
	private final List<GoExpression> values;

	public GoValueSpec(SourceLocation location, List<GoVariableName> names, GoType type, List<GoExpression> values) {
		super(location);
		this.names = names;
		this.type = type;
		this.values = values;
	}

	public List<GoVariableName> getNames() {
		return names;
	}

	public GoType getType() {
		return type;
	}

	public List<GoExpression> getValues() {
		return values;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoValueSpec that = (GoValueSpec) o;
		return Objects.equals(names, that.names) &&
				Objects.equals(type, that.type) &&
				Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type, values);
	}
}
