package jspy.model.js;

import jspy.util.SourceLocation;

public class JSNullLiteral extends JSExpression {

	public JSNullLiteral(SourceLocation location) {
		super(location);
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return JSNullLiteral.class.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return true;
	}
}
