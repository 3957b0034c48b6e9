package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A parsed Go file: its package clause, its top-level declarations in source order, and every
 * comment found in it.
 */
public class GoModule extends GoNode {
	private final String name;
	private final List<GoDeclaration> declarations;
	private final List<GoComment> comments;

	public GoModule(SourceLocation location, String name, List<GoDeclaration> declarations, List<GoComment> comments) {
		super(location);
		this.name = name;
		this.declarations = declarations;
		this.comments = comments;
	}

	public String getName() {
		return name;
	}

	public List<GoDeclaration> getDeclarations() {
		return declarations;
	}

	public List<GoComment> getComments() {
		return comments;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoModule module = (GoModule) o;
		return Objects.equals(name, module.name) &&
				Objects.equals(declarations, module.declarations) &&
				Objects.equals(comments, module.comments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, declarations, comments);
	}
}
