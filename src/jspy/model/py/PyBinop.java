package jspy.model.py;

import java.util.Objects;

public class PyBinop extends PyExpression {

	public enum Operation {
		// grouped by precedence, lowest first
		OR("or", 3),
		AND("and", 4),

		EQ("==", 6),
		NEQ("!=", 6),
		LT("<", 6),
		LEQ("<=", 6),
		GT(">", 6),
		GEQ(">=", 6),
		IS("is", 6),
		IS_NOT("is not", 6),

		PLUS("+", 7),
		MINUS("-", 7),

		TIMES("*", 8),
		DIVIDE("/", 8),
		FLOOR_DIVIDE("//", 8),
		MOD("%", 8),

		POWER("**", 10);

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
	private final PyExpression lhs;
	private final PyExpression rhs;

	public PyBinop(Operation operation, PyExpression lhs, PyExpression rhs) {
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return operation;
	}

	public PyExpression getLhs() {
		return lhs;
	}

	public PyExpression getRhs() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyBinop binop = (PyBinop) o;
		return Objects.equals(operation, binop.operation) &&
				Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}
}
