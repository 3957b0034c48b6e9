package colongo.model.golang.type;

import colongo.model.golang.GoExpression;
import colongo.model.golang.GoExpressionVisitor;
import colongo.util.SourceLocation;

public abstract class GoType extends GoExpression {

	public GoType(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
