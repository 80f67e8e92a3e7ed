package jspy.model.py;

import java.util.Objects;

/**
 * {@code target[index]}
 */
public class PySubscript extends PyExpression {

	private final PyExpression target;
	private final PyExpression index;

	public PySubscript(PyExpression target, PyExpression index) {
		this.target = target;
		this.index = index;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getIndex() {
		return index;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PySubscript subscript = (PySubscript) o;
		return Objects.equals(target, subscript.target) &&
				Objects.equals(index, subscript.index);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, index);
	}
}
