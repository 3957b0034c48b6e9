package colongo;

/**
 * A broken invariant of the translator itself, never a problem with the input.
 */
public class InternalCompilerError extends RuntimeException {

	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}

	public InternalCompilerError(Exception cause) {
		super("internal compiler error", cause);
	}
}
