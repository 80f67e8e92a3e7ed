package jspy.model.py;

import java.util.Objects;

public class PyExpressionStatement extends PyStatement {

	private final PyExpression expression;

	public PyExpressionStatement(PyExpression expression) {
		this.expression = expression;
	}

	public PyExpression getExpression() {
		return expression;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyExpressionStatement expressionStatement = (PyExpressionStatement) o;
		return Objects.equals(expression, expressionStatement.expression);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expression);
	}
}
