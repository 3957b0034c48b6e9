package colongo.model.golang;

import colongo.util.SourceLocation;

public abstract class GoDeclaration extends GoNode {

	public GoDeclaration(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
