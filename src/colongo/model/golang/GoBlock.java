package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A braced statement list. The list is owned by this block: a statement object appears in at
 * most one list, which is what lets statements be found again by identity.
 */
public class GoBlock extends GoStatement {

	private final List<GoStatement> statements;

	public GoBlock(SourceLocation location, List<GoStatement> statements) {
		super(location);
		this.statements = statements;
	}

	public List<GoStatement> getStatements() {
		return statements;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBlock goBlock = (GoBlock) o;
		return Objects.equals(statements, goBlock.statements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(statements);
	}
}
