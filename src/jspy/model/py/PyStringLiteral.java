package jspy.model.py;

import java.util.Objects;

public class PyStringLiteral extends PyExpression {

	private final String value;

	public PyStringLiteral(String value) {
		this.value = value;
	}

	public String getValue() {
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
		PyStringLiteral stringLiteral = (PyStringLiteral) o;
		return Objects.equals(value, stringLiteral.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
