package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Assigns values to one or more targets :
 *
 *
 *  a, b.c, d[i] {op} {expr}, ...
 *
 * The target list and the operator are mutable: desugaring swaps targets for temporaries and
 * turns plain assignments into definitions.
 */
public class GoAssignmentStatement extends GoStatement {

	public enum Operator {
		ASSIGN("="),
		DEFINE(":="),
		ADD_ASSIGN("+="),
		SUB_ASSIGN("-="),
		MUL_ASSIGN("*="),
		QUO_ASSIGN("/="),
		REM_ASSIGN("%="),
		AND_ASSIGN("&="),
		OR_ASSIGN("|="),
		XOR_ASSIGN("^="),
		SHL_ASSIGN("<<="),
		SHR_ASSIGN(">>="),
		AND_NOT_ASSIGN("&^="),
		;

		private final String text;

		Operator(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}
	}

	private final List<GoExpression> lhs;
	private Operator operator;
	private final List<GoExpression> rhs;

	public GoAssignmentStatement(SourceLocation location, List<GoExpression> lhs, Operator operator,
	                             List<GoExpression> rhs) {
		super(location);
		this.lhs = lhs;
		this.operator = operator;
		this.rhs = rhs;
	}

	public List<GoExpression> getLhs() {
		return lhs;
	}

	public Operator getOperator() {
		return operator;
	}

	public void setOperator(Operator operator) {
		this.operator = operator;
	}

	public List<GoExpression> getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoAssignmentStatement that = (GoAssignmentStatement) o;
		return operator == that.operator &&
				Objects.equals(lhs, that.lhs) &&
				Objects.equals(rhs, that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operator, rhs);
	}
}
