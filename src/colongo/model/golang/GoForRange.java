package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * for key, value {op} range expr { ... }
 *
 * key, value and the operator are all null for a bare "for range expr".
 */
public class GoForRange extends GoStatement {

	private final GoExpression key;
	private final GoExpression value;
	private GoAssignmentStatement.Operator operator;
	private final GoExpression rangeExpr;
	private final GoBlock body;

	public GoForRange(SourceLocation location, GoExpression key, GoExpression value,
	                  GoAssignmentStatement.Operator operator, GoExpression rangeExpr, GoBlock body) {
		super(location);
		this.key = key;
		this.value = value;
		this.operator = operator;
		this.rangeExpr = rangeExpr;
		this.body = body;
	}

	public GoExpression getKey() {
		return key;
	}

	public GoExpression getValue() {
		return value;
	}

	public GoAssignmentStatement.Operator getOperator() {
		return operator;
	}

	public void setOperator(GoAssignmentStatement.Operator operator) {
		this.operator = operator;
	}

	public GoExpression getRangeExpr() {
		return rangeExpr;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoForRange that = (GoForRange) o;
		return operator == that.operator &&
				Objects.equals(key, that.key) &&
				Objects.equals(value, that.value) &&
				Objects.equals(rangeExpr, that.rangeExpr) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value, operator, rangeExpr, body);
	}
}
