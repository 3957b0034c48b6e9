package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A function call or a conversion; the parser cannot tell them apart.
 */
public class GoCall extends GoExpression {

	private final GoExpression function;
	private final List<GoExpression> arguments;
	// whether the last argument is spread with "..."
	private final boolean ellipsis;
	private final GoLineBreaks lineBreaks;

	public GoCall(SourceLocation location, GoExpression function, List<GoExpression> arguments, boolean ellipsis,
	              GoLineBreaks lineBreaks) {
		super(location);
		this.function = function;
		this.arguments = arguments;
		this.ellipsis = ellipsis;
		this.lineBreaks = lineBreaks;
	}

	public GoExpression getFunction() {
		return function;
	}

	public List<GoExpression> getArguments() {
		return arguments;
	}

	public boolean hasEllipsis() {
		return ellipsis;
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
		GoCall goCall = (GoCall) o;
		return ellipsis == goCall.ellipsis &&
				Objects.equals(function, goCall.function) &&
				Objects.equals(arguments, goCall.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments, ellipsis);
	}
}
