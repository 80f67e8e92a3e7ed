package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSLogicalExpression extends JSExpression {

	public enum Operator {
		AND("&&"),
		OR("||");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final JSExpression left;
	private final JSExpression right;

	public JSLogicalExpression(SourceLocation location, Operator operator, JSExpression left, JSExpression right) {
		super(location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public Operator getOperator() {
		return operator;
	}

	public JSExpression getLeft() {
		return left;
	}

	public JSExpression getRight() {
		return right;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, left, right);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSLogicalExpression other = (JSLogicalExpression) obj;
		return Objects.equals(operator, other.operator) &&
				Objects.equals(left, other.left) &&
				Objects.equals(right, other.right);
	}
}
