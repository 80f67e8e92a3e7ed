package jspy.model.js;

import jspy.scope.UID;
import jspy.util.SourceLocatable;
import jspy.util.SourceLocation;

/**
 * Base of the immutable JavaScript input tree. Nodes compare structurally; analysis results are attached through
 * side tables keyed by {@link #getUID()}, which is unique per node instance.
 */
public abstract class JSNode extends SourceLocatable {

	private final SourceLocation location;
	private final UID uid;

	public JSNode(SourceLocation location) {
		this.location = location;
		this.uid = new UID();
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public UID getUID() {
		return uid;
	}

	/**
	 * @return the node kind as it appears in error messages, e.g. {@code ForStatement}
	 */
	public String getKind() {
		return getClass().getSimpleName().substring("JS".length());
	}

	@Override
	public abstract int hashCode();

	@Override
	public abstract boolean equals(Object obj);

	@Override
	public String toString() {
		return getKind() + " " + location;
	}

}
