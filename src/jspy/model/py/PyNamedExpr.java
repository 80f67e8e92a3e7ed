package jspy.model.py;

import java.util.Objects;

/**
 * The assignment expression {@code target := value}.
 */
public class PyNamedExpr extends PyExpression {

	private final PyName target;
	private final PyExpression value;

	public PyNamedExpr(PyName target, PyExpression value) {
		this.target = target;
		this.value = value;
	}

	public PyName getTarget() {
		return target;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyNamedExpr namedExpr = (PyNamedExpr) o;
		return Objects.equals(target, namedExpr.target) &&
				Objects.equals(value, namedExpr.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, value);
	}
}
