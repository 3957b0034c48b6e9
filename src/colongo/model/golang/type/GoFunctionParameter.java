package colongo.model.golang.type;

import colongo.model.golang.GoNode;
import colongo.model.golang.GoNodeVisitor;
import colongo.model.golang.GoVariableName;
import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One group of a parameter or result list: "a, b int", "xs ...string" or an unnamed "error".
 */
public class GoFunctionParameter extends GoNode {

	private final List<GoVariableName> names;
	private final GoType type;
	private final boolean variadic;

	public GoFunctionParameter(SourceLocation location, List<GoVariableName> names, GoType type, boolean variadic) {
		super(location);
		this.names = names;
		this.type = type;
		this.variadic = variadic;
	}

	public List<GoVariableName> getNames() {
		return names;
	}

	public GoType getType() {
		return type;
	}

	public boolean isVariadic() {
		return variadic;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFunctionParameter that = (GoFunctionParameter) o;
		return variadic == that.variadic &&
				Objects.equals(names, that.names) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type, variadic);
	}
}
