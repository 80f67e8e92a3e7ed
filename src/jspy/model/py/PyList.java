package jspy.model.py;

import java.util.List;
import java.util.Objects;

public class PyList extends PyExpression {

	private final List<PyExpression> elements;

	public PyList(List<PyExpression> elements) {
		this.elements = elements;
	}

	public List<PyExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyList list = (PyList) o;
		return Objects.equals(elements, list.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}
}
