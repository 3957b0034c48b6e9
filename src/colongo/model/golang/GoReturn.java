package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoReturn extends GoStatement {

	private final List<GoExpression> values;

	public GoReturn(SourceLocation location, List<GoExpression> values) {
		super(location);
		this.values = values;
	}

	public List<GoExpression> getValues() {
		return values;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoReturn goReturn = (GoReturn) o;
		return Objects.equals(values, goReturn.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(values);
	}
}
