package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoMapType extends GoType {

	private final GoType keyType;
	private final GoType valueType;

	public GoMapType(SourceLocation location, GoType keyType, GoType valueType) {
		super(location);
		this.keyType = keyType;
		this.valueType = valueType;
	}

	public GoType getKeyType() {
		return keyType;
	}

	public GoType getValueType() {
		return valueType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoMapType goMapType = (GoMapType) o;
		return Objects.equals(keyType, goMapType.keyType) &&
				Objects.equals(valueType, goMapType.valueType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyType, valueType);
	}
}
