package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A case clause of an expression or type switch. A null expression list marks the default clause.
 */
public class GoSwitchCase extends GoNode {

	private final List<GoExpression> expressions;
	private final List<GoStatement> body;

	public GoSwitchCase(SourceLocation location, List<GoExpression> expressions, List<GoStatement> body) {
		super(location);
		this.expressions = expressions;
		this.body = body;
	}

	public List<GoExpression> getExpressions() {
		return expressions;
	}

	public boolean isDefault() {
		return expressions == null;
	}

	public List<GoStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSwitchCase that = (GoSwitchCase) o;
		return Objects.equals(expressions, that.expressions) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expressions, body);
	}
}
