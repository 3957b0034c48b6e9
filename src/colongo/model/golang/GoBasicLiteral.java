package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * A number, rune or string literal, kept exactly as written.
 */
public class GoBasicLiteral extends GoExpression {

	public enum Kind {
		INT,
		FLOAT,
		IMAG,
		CHAR,
		STRING,
	}

	private final Kind kind;
	private final String value;

	public GoBasicLiteral(SourceLocation location, Kind kind, String value) {
		super(location);
		this.kind = kind;
		this.value = value;
	}

	public Kind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBasicLiteral that = (GoBasicLiteral) o;
		return kind == that.kind &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}
}
