package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoInterfaceType extends GoType {

	private final List<GoInterfaceTypeField> fields;

	public GoInterfaceType(SourceLocation location, List<GoInterfaceTypeField> fields) {
		super(location);
		this.fields = fields;
	}

	public List<GoInterfaceTypeField> getFields() {
		return fields;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoInterfaceType that = (GoInterfaceType) o;
		return Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields);
	}
}
