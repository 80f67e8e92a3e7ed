package jspy.model.js;

import jspy.util.SourceLocation;

public abstract class JSExpression extends JSNode {
	public JSExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E;
}
