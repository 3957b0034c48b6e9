package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoFor extends GoStatement {

	private final GoStatement init;
	private final GoExpression condition;
	private final GoStatement post;
	private final GoBlock body;

	public GoFor(SourceLocation location, GoStatement init, GoExpression condition, GoStatement post, GoBlock body) {
		super(location);
		this.init = init;
		this.condition = condition;
		this.post = post;
		this.body = body;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoExpression getCondition() {
		return condition;
	}

	public GoStatement getPost() {
		return post;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFor goFor = (GoFor) o;
		return Objects.equals(init, goFor.init) &&
				Objects.equals(condition, goFor.condition) &&
				Objects.equals(post, goFor.post) &&
				Objects.equals(body, goFor.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, condition, post, body);
	}
}
