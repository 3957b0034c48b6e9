package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoSliceType extends GoType {

	private final GoType elementType;

	public GoSliceType(SourceLocation location, GoType elementType) {
		super(location);
		this.elementType = elementType;
	}

	public GoType getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSliceType that = (GoSliceType) o;
		return Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(GoSliceType.class, elementType);
	}
}
