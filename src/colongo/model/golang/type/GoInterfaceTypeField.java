package colongo.model.golang.type;

import colongo.model.golang.GoNode;
import colongo.model.golang.GoNodeVisitor;
import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * A method (name and {@link GoFunctionType}) or, when the name is null, an embedded interface.
 */
public class GoInterfaceTypeField extends GoNode {

	private final String name;
	private final GoType type;

	public GoInterfaceTypeField(SourceLocation location, String name, GoType type) {
		super(location);
		this.name = name;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public GoType getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoInterfaceTypeField that = (GoInterfaceTypeField) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, type);
	}
}
