package colongo;

/**
 * Raised when the command line or the configuration file is not usable.
 */
public class ColonGoOptionException extends ColonGoException {

	private static final long serialVersionUID = 6143722108450207831L;
	private static final String prefix = "Option Error";

	public ColonGoOptionException(String msg) {
		super(prefix, msg);
	}

}
