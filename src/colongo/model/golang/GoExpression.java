package colongo.model.golang;

import colongo.util.SourceLocation;

/**
 * A Go expression. Types are expressions too, since Go's grammar lets them appear where
 * expressions do (conversions, composite literals, make and new arguments).
 */
public abstract class GoExpression extends GoNode {

	public GoExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E;

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
