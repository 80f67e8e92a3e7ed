package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSExpressionStatement extends JSStatement {

	private final JSExpression expression;

	public JSExpressionStatement(SourceLocation location, JSExpression expression) {
		super(location);
		this.expression = expression;
	}

	public JSExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSExpressionStatement other = (JSExpressionStatement) obj;
		return Objects.equals(expression, other.expression);
	}
}
