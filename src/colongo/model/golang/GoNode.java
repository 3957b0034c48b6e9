package colongo.model.golang;

import colongo.formatters.FormattingTools;
import colongo.util.SourceLocation;

/**
 * A node of a parsed Go file. Nodes built by the translator itself carry an unknown location.
 */
public abstract class GoNode {

	private final SourceLocation location;

	public GoNode(SourceLocation location) {
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		return FormattingTools.format(this);
	}

}
