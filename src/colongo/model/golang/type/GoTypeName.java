package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * A named type, possibly qualified by its package ("T", "io.Reader").
 */
public class GoTypeName extends GoType {

	private String name;

	public GoTypeName(SourceLocation location, String name) {
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
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeName that = (GoTypeName) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
