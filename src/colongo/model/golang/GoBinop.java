package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoBinop extends GoExpression {

	public enum Operation {
		LOR("||", 1),
		LAND("&&", 2),
		EQL("==", 3),
		NEQ("!=", 3),
		LSS("<", 3),
		LEQ("<=", 3),
		GTR(">", 3),
		GEQ(">=", 3),
		ADD("+", 4),
		SUB("-", 4),
		OR("|", 4),
		XOR("^", 4),
		MUL("*", 5),
		QUO("/", 5),
		REM("%", 5),
		SHL("<<", 5),
		SHR(">>", 5),
		AND("&", 5),
		AND_NOT("&^", 5),
		;

		private final String text;
		private final int precedence;

		Operation(String text, int precedence) {
			this.text = text;
			this.precedence = precedence;
		}

		public String getText() {
			return text;
		}

		public int getPrecedence() {
			return precedence;
		}
	}

	private final Operation operation;
	private final GoExpression lhs;
	private final GoExpression rhs;
	// whether the source continued on a new line after the operator
	private final boolean lineBreak;

	public GoBinop(SourceLocation location, Operation operation, GoExpression lhs, GoExpression rhs, boolean lineBreak) {
		super(location);
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
		this.lineBreak = lineBreak;
	}

	public Operation getOperation() {
		return operation;
	}

	public GoExpression getLHS() {
		return lhs;
	}

	public GoExpression getRHS() {
		return rhs;
	}

	public boolean hasLineBreak() {
		return lineBreak;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBinop goBinop = (GoBinop) o;
		return operation == goBinop.operation &&
				Objects.equals(lhs, goBinop.lhs) &&
				Objects.equals(rhs, goBinop.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}
}
