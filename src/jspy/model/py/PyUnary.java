package jspy.model.py;

import java.util.Objects;

public class PyUnary extends PyExpression {

	public enum Operation {
		NOT("not ", 5),
		NEG("-", 9),
		POS("+", 9);

		private final String symbol;
		private final int precedence;

		Operation(String symbol, int precedence) {
			this.symbol = symbol;
			this.precedence = precedence;
		}

		public String getSymbol() {
			return symbol;
		}

		public int getPrecedence() {
			return precedence;
		}
	}

	private final Operation operation;
	private final PyExpression operand;

	public PyUnary(Operation operation, PyExpression operand) {
		this.operation = operation;
		this.operand = operand;
	}

	public Operation getOperation() {
		return operation;
	}

	public PyExpression getOperand() {
		return operand;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyUnary unary = (PyUnary) o;
		return Objects.equals(operation, unary.operation) &&
				Objects.equals(operand, unary.operand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, operand);
	}
}
