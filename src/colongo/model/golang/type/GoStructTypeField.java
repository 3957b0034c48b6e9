package colongo.model.golang.type;

import colongo.model.golang.GoNode;
import colongo.model.golang.GoNodeVisitor;
import colongo.model.golang.GoVariableName;
import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A struct field group; an empty name list means an embedded field.
 */
public class GoStructTypeField extends GoNode {

	private final List<GoVariableName> names;
	private final GoType type;
	// the raw string literal, or null
	private final String tag;

	public GoStructTypeField(SourceLocation location, List<GoVariableName> names, GoType type, String tag) {
		super(location);
		this.names = names;
		this.type = type;
		this.tag = tag;
	}

	public List<GoVariableName> getNames() {
		return names;
	}

	public GoType getType() {
		return type;
	}

	public String getTag() {
		return tag;
	}

	public boolean isEmbedded() {
		return names.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoStructTypeField that = (GoStructTypeField) o;
		return Objects.equals(names, that.names) &&
				Objects.equals(type, that.type) &&
				Objects.equals(tag, that.tag);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type, tag);
	}
}
