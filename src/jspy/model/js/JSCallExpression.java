package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSCallExpression extends JSExpression {

	private final JSExpression callee;
	private final List<JSExpression> arguments;

	public JSCallExpression(SourceLocation location, JSExpression callee, List<JSExpression> arguments) {
		super(location);
		this.callee = callee;
		this.arguments = arguments;
	}

	public JSExpression getCallee() {
		return callee;
	}

	public List<JSExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(callee, arguments);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSCallExpression other = (JSCallExpression) obj;
		return Objects.equals(callee, other.callee) &&
				Objects.equals(arguments, other.arguments);
	}
}
