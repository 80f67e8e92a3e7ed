package jspy.model.py;

import java.util.Objects;

public class PyNumberLiteral extends PyExpression {

	private final double value;

	public PyNumberLiteral(double value) {
		this.value = value;
	}

	public double getValue() {
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
		PyNumberLiteral numberLiteral = (PyNumberLiteral) o;
		return Double.compare(value, numberLiteral.value) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}
}
