package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A var or const declaration, either a single spec or a parenthesized group of them.
 */
public class GoVariableDeclaration extends GoDeclaration {

	private final boolean constant;
	private final boolean grouped;
	private final List<GoValueSpec> specs;

	public GoVariableDeclaration(SourceLocation location, boolean constant, boolean grouped, List<GoValueSpec> specs) {
		super(location);
		this.constant = constant;
		this.grouped = grouped;
		this.specs = specs;
	}

	public boolean isConstant() {
		return constant;
	}

	public boolean isGrouped() {
		return grouped;
	}

	public List<GoValueSpec> getSpecs() {
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
		GoVariableDeclaration that = (GoVariableDeclaration) o;
		return constant == that.constant &&
				grouped == that.grouped &&
				Objects.equals(specs, that.specs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(constant, grouped, specs);
	}
}
