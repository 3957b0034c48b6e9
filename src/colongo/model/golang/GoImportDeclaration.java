package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoImportDeclaration extends GoDeclaration {

	private final boolean grouped;
	private final List<GoImportSpec> specs;

	public GoImportDeclaration(SourceLocation location, boolean grouped, List<GoImportSpec> specs) {
		super(location);
		this.grouped = grouped;
		this.specs = specs;
	}

	public boolean isGrouped() {
		return grouped;
	}

	public List<GoImportSpec> getSpecs() {
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
		GoImportDeclaration that = (GoImportDeclaration) o;
		return grouped == that.grouped &&
				Objects.equals(specs, that.specs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(grouped, specs);
	}
}
