package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoChanType extends GoType {

	public enum Direction {
		// chan T
		BOTH,
		// chan<- T
		SEND,
		// <-chan T
		RECV,
	}

	private final Direction direction;
	private final GoType elementType;

	public GoChanType(SourceLocation location, Direction direction, GoType elementType) {
		super(location);
		this.direction = direction;
		this.elementType = elementType;
	}

	public Direction getDirection() {
		return direction;
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
		GoChanType that = (GoChanType) o;
		return direction == that.direction &&
				Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(direction, elementType);
	}
}
