package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class GoSwitch extends GoStatement {

	private final GoStatement init;
	private final GoExpression tag;
	private final List<GoSwitchCase> cases;

	public GoSwitch(SourceLocation location, GoStatement init, GoExpression tag, List<GoSwitchCase> cases) {
		super(location);
		this.init = init;
		this.tag = tag;
		this.cases = cases;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoExpression getTag() {
		return tag;
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
		GoSwitch goSwitch = (GoSwitch) o;
		return Objects.equals(init, goSwitch.init) &&
				Objects.equals(tag, goSwitch.tag) &&
				Objects.equals(cases, goSwitch.cases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, tag, cases);
	}
}
