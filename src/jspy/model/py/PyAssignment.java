package jspy.model.py;

import java.util.Objects;

public class PyAssignment extends PyStatement {

	private final PyExpression target;
	private final PyExpression value;

	public PyAssignment(PyExpression target, PyExpression value) {
		this.target = target;
		this.value = value;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyAssignment assignment = (PyAssignment) o;
		return Objects.equals(target, assignment.target) &&
				Objects.equals(value, assignment.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, value);
	}
}
