package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * A var, const or type declaration inside a function body.
 */
public class GoDeclarationStatement extends GoStatement {

	private final GoDeclaration declaration;

	public GoDeclarationStatement(SourceLocation location, GoDeclaration declaration) {
		super(location);
		this.declaration = declaration;
	}

	public GoDeclaration getDeclaration() {
		return declaration;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoDeclarationStatement that = (GoDeclarationStatement) o;
		return Objects.equals(declaration, that.declaration);
	}

	@Override
	public int hashCode() {
		return Objects.hash(declaration);
	}
}
