package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoUnary extends GoExpression {

	public enum Operation {
		POS("+"),
		NEG("-"),
		NOT("!"),
		COMPLEMENT("^"),
		DEREF("*"),
		ADDR("&"),
		RECV("<-"),
		;

		private final String text;

		Operation(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}
	}

	private final Operation operation;
	private final GoExpression target;

	public GoUnary(SourceLocation location, Operation operation, GoExpression target) {
		super(location);
		this.operation = operation;
		this.target = target;
	}

	public Operation getOperation() {
		return operation;
	}

	public GoExpression getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoUnary goUnary = (GoUnary) o;
		return operation == goUnary.operation &&
				Objects.equals(target, goUnary.target);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, target);
	}
}
