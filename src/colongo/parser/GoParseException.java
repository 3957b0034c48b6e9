package colongo.parser;

import colongo.util.SourceLocation;

/**
 * Raised on the first syntax error in a Go file. Parsing does not recover.
 */
@SuppressWarnings("serial")
public class GoParseException extends Exception {

	private final SourceLocation location;
	private final String reason;

	public GoParseException(SourceLocation location, String reason) {
		super(location.prettyString() + ": " + reason);
		this.location = location;
		this.reason = reason;
	}

	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the message without the location prefix
	 */
	public String getReason() {
		return reason;
	}

}
