package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoSelect extends GoStatement {

	private final List<GoSelectCase> cases;

	public GoSelect(SourceLocation location, List<GoSelectCase> cases) {
		super(location);
		this.cases = cases;
	}

	public List<GoSelectCase> getCases() {
		return cases;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSelect goSelect = (GoSelect) o;
		return Objects.equals(cases, goSelect.cases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(cases);
	}
}
