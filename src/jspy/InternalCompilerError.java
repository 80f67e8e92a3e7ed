package jspy;

/**
 * A broken invariant inside the translator itself, as opposed to an issue with the input program.
 */
public class InternalCompilerError extends RuntimeException {
	public InternalCompilerError(String detail) {
		super("internal compiler error: " + detail);
	}
}
