package jspy.model.js;

import jspy.util.SourceLocation;

public abstract class JSStatement extends JSNode {
	public JSStatement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E;
}
