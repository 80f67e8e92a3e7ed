package jspy.trans.passes.codegen;

import jspy.scope.IdentifierSanitizer;

/**
 * Hands out compiler-introduced binding names. All names start with {@link IdentifierSanitizer#TEMP_PREFIX}, which
 * the sanitizer never lets a user identifier keep, so temps cannot collide with resolved user names.
 *
 * Numbering restarts at every function boundary so identical inputs produce identical output.
 */
public class TempAllocator {

	private static final String TEMP = IdentifierSanitizer.TEMP_PREFIX + "tmp";
	private static final String SWITCH_DISCRIMINANT = IdentifierSanitizer.TEMP_PREFIX + "switch_disc_";

	private int counter = 0;

	public String next() {
		return TEMP + (++counter);
	}

	public String nextSwitchDiscriminant() {
		return SWITCH_DISCRIMINANT + (++counter);
	}

	public void reset() {
		counter = 0;
	}

	/**
	 * @return the current position, to be handed back to {@link #restore(int)} once a nested function is done
	 */
	public int mark() {
		return counter;
	}

	public void restore(int mark) {
		counter = mark;
	}
}
