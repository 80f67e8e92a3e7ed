package jspy.model.py;

import java.util.Objects;

/**
 * {@code target[lower:upper]}; either bound may be null.
 */
public class PySlice extends PyExpression {

	private final PyExpression target;
	private final PyExpression lower;
	private final PyExpression upper;

	public PySlice(PyExpression target, PyExpression lower, PyExpression upper) {
		this.target = target;
		this.lower = lower;
		this.upper = upper;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getLower() {
		return lower;
	}

	public PyExpression getUpper() {
		return upper;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PySlice slice = (PySlice) o;
		return Objects.equals(target, slice.target) &&
				Objects.equals(lower, slice.lower) &&
				Objects.equals(upper, slice.upper);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, lower, upper);
	}
}
