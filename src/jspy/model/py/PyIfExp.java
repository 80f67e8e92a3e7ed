package jspy.model.py;

import java.util.Objects;

/**
 * The conditional expression {@code body if test else orElse}.
 */
public class PyIfExp extends PyExpression {

	private final PyExpression test;
	private final PyExpression body;
	private final PyExpression orElse;

	public PyIfExp(PyExpression test, PyExpression body, PyExpression orElse) {
		this.test = test;
		this.body = body;
		this.orElse = orElse;
	}

	public PyExpression getTest() {
		return test;
	}

	public PyExpression getBody() {
		return body;
	}

	public PyExpression getOrElse() {
		return orElse;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyIfExp ifExp = (PyIfExp) o;
		return Objects.equals(test, ifExp.test) &&
				Objects.equals(body, ifExp.body) &&
				Objects.equals(orElse, ifExp.orElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, body, orElse);
	}
}
