package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoTypeDeclaration extends GoDeclaration {

	private final boolean grouped;
	private final List<GoTypeSpec> specs;

	public GoTypeDeclaration(SourceLocation location, boolean grouped, List<GoTypeSpec> specs) {
		super(location);
		this.grouped = grouped;
		this.specs = specs;
	}

	public boolean isGrouped() {
		return grouped;
	}

	public List<GoTypeSpec> getSpecs() {
		return specs;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeDeclaration that = (GoTypeDeclaration) o;
		return grouped == that.grouped &&
				Objects.equals(specs, that.specs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(grouped, specs);
	}
}
