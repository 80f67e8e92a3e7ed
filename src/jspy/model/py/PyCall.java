package jspy.model.py;

import java.util.List;
import java.util.Objects;

public class PyCall extends PyExpression {

	private final PyExpression function;
	private final List<PyExpression> arguments;

	public PyCall(PyExpression function, List<PyExpression> arguments) {
		this.function = function;
		this.arguments = arguments;
	}

	public PyExpression getFunction() {
		return function;
	}

	public List<PyExpression> getArguments() {
		return arguments;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyCall call = (PyCall) o;
		return Objects.equals(function, call.function) &&
				Objects.equals(arguments, call.arguments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(function, arguments);
	}
}
