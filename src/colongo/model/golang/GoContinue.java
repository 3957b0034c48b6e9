package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoContinue extends GoStatement {

	// null when the continue targets the innermost enclosing statement
	private final String label;

	public GoContinue(SourceLocation location, String label) {
		super(location);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoContinue that = (GoContinue) o;
		return Objects.equals(label, that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label);
	}
}
