package colongo;

/**
 * An exception consisting of a prefix (the kind of error) and a message.
 */
public abstract class ColonGoException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public ColonGoException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
