package jspy.model.py;

import java.util.Objects;

public class PyAttribute extends PyExpression {

	private final PyExpression target;
	private final String attribute;

	public PyAttribute(PyExpression target, String attribute) {
		this.target = target;
		this.attribute = attribute;
	}

	public PyExpression getTarget() {
		return target;
	}

	public String getAttribute() {
		return attribute;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAttribute other = (PyAttribute) o;
		return Objects.equals(target, other.target) &&
				Objects.equals(attribute, other.attribute);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, attribute);
	}
}
