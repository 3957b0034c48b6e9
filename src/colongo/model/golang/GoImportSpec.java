package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

public class GoImportSpec extends GoNode {

	// null, "." , "_" or a package alias
	private final String name;
	// the quoted import path as written
	private final String path;

	public GoImportSpec(SourceLocation location, String name, String path) {
		super(location);
		this.name = name;
		this.path = path;
	}

	public String getName() {
		return name;
	}

	public String getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoImportSpec that = (GoImportSpec) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(path, that.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, path);
	}
}
