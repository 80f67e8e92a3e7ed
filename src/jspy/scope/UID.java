package jspy.scope;

/**
 * Identity token for a node of the input tree. Side tables produced by analysis passes are keyed by UIDs, so the
 * input tree itself never needs to be mutated.
 */
public final class UID {

	@Override
	public String toString() {
		return "UID@" + Integer.toHexString(System.identityHashCode(this));
	}
}
