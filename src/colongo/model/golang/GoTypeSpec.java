package colongo.model.golang;

import colongo.model.golang.type.GoType;
import colongo.util.SourceLocation;

import java.util.Objects;

public class GoTypeSpec extends GoNode {

	private final String name;
	private final boolean alias;
	private final GoType type;

	public GoTypeSpec(SourceLocation location, String name, boolean alias, GoType type) {
		super(location);
		this.name = name;
		this.alias = alias;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public boolean isAlias() {
		return alias;
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
		GoTypeSpec that = (GoTypeSpec) o;
		return alias == that.alias &&
				Objects.equals(name, that.name) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, alias, type);
	}
}
