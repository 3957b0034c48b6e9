package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * label: statement
 *
 * The label decorates exactly one statement, so replacing that statement goes through
 * {@link #setStatement(GoStatement)}.
 */
public class GoLabeledStatement extends GoStatement {

	private final String label;
	private GoStatement statement;

	public GoLabeledStatement(SourceLocation location, String label, GoStatement statement) {
		super(location);
		this.label = label;
		this.statement = statement;
	}

	public String getLabel() {
		return label;
	}

	public GoStatement getStatement() {
		return statement;
	}

	public void setStatement(GoStatement statement) {
		this.statement = statement;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoLabeledStatement that = (GoLabeledStatement) o;
		return Objects.equals(label, that.label) &&
				Objects.equals(statement, that.statement);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, statement);
	}
}
