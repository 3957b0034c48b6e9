package colongo.model.golang.type;

import colongo.model.golang.GoExpression;
import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * [length]T, or [...]T when the length is null.
 */
public class GoArrayType extends GoType {

	private final GoExpression length;
	private final GoType elementType;

	public GoArrayType(SourceLocation location, GoExpression length, GoType elementType) {
		super(location);
		this.length = length;
		this.elementType = elementType;
	}

	public GoExpression getLength() {
		return length;
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
		GoArrayType that = (GoArrayType) o;
		return Objects.equals(length, that.length) &&
				Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(length, elementType);
	}
}
