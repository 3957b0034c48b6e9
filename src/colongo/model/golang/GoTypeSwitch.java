package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * switch init; x := y.(type) { ... }
 *
 * The guard is either a {@link GoAssignmentStatement} binding the switched value or a
 * {@link GoExpressionStatement} holding the bare type assertion.
 */
public class GoTypeSwitch extends GoStatement {

	private final GoStatement init;
	private final GoStatement guard;
	private final List<GoSwitchCase> cases;

	public GoTypeSwitch(SourceLocation location, GoStatement init, GoStatement guard, List<GoSwitchCase> cases) {
		super(location);
		this.init = init;
		this.guard = guard;
		this.cases = cases;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoStatement getGuard() {
		return guard;
	}

	public List<GoSwitchCase> getCases() {
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
		GoTypeSwitch that = (GoTypeSwitch) o;
		return Objects.equals(init, that.init) &&
				Objects.equals(guard, that.guard) &&
				Objects.equals(cases, that.cases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, guard, cases);
	}
}
