package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * A line or general comment, with its delimiters. Comments are kept on the module rather than
 * in the tree; the printer puts them back by location.
 */
public class GoComment extends GoNode {

	private final String text;

	public GoComment(SourceLocation location, String text) {
		super(location);
		this.text = text;
	}

	public String getText() {
		return text;
	}

	public boolean isLineComment() {
		return text.startsWith("//");
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoComment that = (GoComment) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
