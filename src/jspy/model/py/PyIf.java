package jspy.model.py;

import java.util.List;
import java.util.Objects;

/**
 * An if statement. An else branch consisting of a single if statement prints as {@code elif}.
 */
public class PyIf extends PyStatement {

	private final PyExpression condition;
	private final List<PyStatement> body;
	private final List<PyStatement> orElse;

	public PyIf(PyExpression condition, List<PyStatement> body, List<PyStatement> orElse) {
		this.condition = condition;
		this.body = body;
		this.orElse = orElse;
	}

	public PyExpression getCondition() {
		return condition;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	public List<PyStatement> getOrElse() {
		return orElse;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyIf that = (PyIf) o;
		return Objects.equals(condition, that.condition) &&
				Objects.equals(body, that.body) &&
				Objects.equals(orElse, that.orElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(condition, body, orElse);
	}
}
