package colongo.lexer;

import colongo.util.SourceLocation;

public class GoToken {

	private final String value;
	private final GoTokenType type;
	private final int offset;
	private final int endOffset;
	private final SourceLocation location;

	/**
	 * @param value the literal text of the token; "\n" for semicolons inserted at line ends
	 * @param offset where the token starts in the scanned text
	 * @param endOffset where the token ends (exclusive) in the scanned text
	 * @param location the token's span in the user's source
	 */
	public GoToken(String value, GoTokenType type, int offset, int endOffset, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.offset = offset;
		this.endOffset = endOffset;
		this.location = location;
	}

	public String getValue() {
		return value;
	}

	public GoTokenType getType() {
		return type;
	}

	public int getOffset() {
		return offset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return whether this is a semicolon the scanner inserted at the end of a line
	 */
	public boolean isAutomaticSemicolon() {
		return type == GoTokenType.SEMICOLON && value.equals("\n");
	}

	@Override
	public String toString() {
		return "GoToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + offset;
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		GoToken other = (GoToken) obj;
		if (offset != other.offset)
			return false;
		if (type != other.type)
			return false;
		if (value == null) {
			if (other.value != null)
				return false;
		} else if (!value.equals(other.value))
			return false;
		return true;
	}

}
