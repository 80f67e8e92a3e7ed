package jspy.model.py;

import java.util.List;
import java.util.Objects;

public class PyWhile extends PyStatement {

	private final PyExpression condition;
	private final List<PyStatement> body;

	public PyWhile(PyExpression condition, List<PyStatement> body) {
		this.condition = condition;
		this.body = body;
	}

	public PyExpression getCondition() {
		return condition;
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
		PyWhile that = (PyWhile) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body);
	}
}
