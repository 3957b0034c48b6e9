package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A communication clause of a select statement. The communication is a send, a receive
 * (possibly assigned), or null for the default clause.
 */
public class GoSelectCase extends GoNode {

	private final GoStatement communication;
	private final List<GoStatement> body;

	public GoSelectCase(SourceLocation location, GoStatement communication, List<GoStatement> body) {
		super(location);
		this.communication = communication;
		this.body = body;
	}

	public GoStatement getCommunication() {
		return communication;
	}

	public boolean isDefault() {
		return communication == null;
	}

	public List<GoStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSelectCase that = (GoSelectCase) o;
		return Objects.equals(communication, that.communication) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(communication, body);
	}
}
