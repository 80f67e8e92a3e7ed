package jspy;

/**
 * Marks a branch that earlier checks already exclude, such as an operator handled before a switch or an IO error
 * from an in-memory writer.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(String branch) {
		super("reached " + branch);
	}

	public Unreachable(Throwable cause) {
		super("in-memory output failed", cause);
	}
}
