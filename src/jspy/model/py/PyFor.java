package jspy.model.py;

import java.util.List;
import java.util.Objects;

public class PyFor extends PyStatement {

	private final PyExpression target;
	private final PyExpression iterable;
	private final List<PyStatement> body;

	public PyFor(PyExpression target, PyExpression iterable, List<PyStatement> body) {
		this.target = target;
		this.iterable = iterable;
		this.body = body;
	}

	public PyExpression getTarget() {
		return target;
	}

	public PyExpression getIterable() {
		return iterable;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyFor that = (PyFor) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(iterable, that.iterable) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, iterable, body);
	}
}
