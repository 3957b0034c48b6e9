package colongo.model.golang;

import colongo.model.golang.type.GoType;
import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * T{a, b} or T{k: v, ...}. The literal type is an expression since it may be a plain or qualified
 * name, and it is null for elided types inside an enclosing literal.
 */
public class GoCompositeLiteral extends GoExpression {

	private final GoExpression type;
	private final List<GoExpression> elements;
	private final GoLineBreaks lineBreaks;

	public GoCompositeLiteral(SourceLocation location, GoExpression type, List<GoExpression> elements,
	                          GoLineBreaks lineBreaks) {
		super(location);
		this.type = type;
		this.elements = elements;
		this.lineBreaks = lineBreaks;
	}

	public GoExpression getType() {
		return type;
	}

	public List<GoExpression> getElements() {
		return elements;
	}

	public GoLineBreaks getLineBreaks() {
		return lineBreaks;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoCompositeLiteral that = (GoCompositeLiteral) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, elements);
	}
}
