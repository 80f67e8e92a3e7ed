package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSAssignmentExpression extends JSExpression {

	public enum Operator {
		ASSIGN("=", null),
		ADD("+=", JSBinaryExpression.Operator.ADD),
		SUB("-=", JSBinaryExpression.Operator.SUB),
		MUL("*=", JSBinaryExpression.Operator.MUL),
		DIV("/=", JSBinaryExpression.Operator.DIV),
		MOD("%=", JSBinaryExpression.Operator.MOD),
		BIT_AND("&=", JSBinaryExpression.Operator.BIT_AND),
		BIT_OR("|=", JSBinaryExpression.Operator.BIT_OR),
		BIT_XOR("^=", JSBinaryExpression.Operator.BIT_XOR),
		LSH("<<=", JSBinaryExpression.Operator.LSH),
		RSH(">>=", JSBinaryExpression.Operator.RSH),
		URSH(">>>=", JSBinaryExpression.Operator.URSH);

		private final String symbol;
		private final JSBinaryExpression.Operator binaryOperator;

		Operator(String symbol, JSBinaryExpression.Operator binaryOperator) {
			this.symbol = symbol;
			this.binaryOperator = binaryOperator;
		}

		public String getSymbol() {
			return symbol;
		}

		/**
		 * @return the operator a compound assignment applies, or null for plain assignment
		 */
		public JSBinaryExpression.Operator getBinaryOperator() {
			return binaryOperator;
		}
	}

	private final Operator operator;
	private final JSExpression target;
	private final JSExpression value;

	public JSAssignmentExpression(SourceLocation location, Operator operator, JSExpression target, JSExpression value) {
		super(location);
		this.operator = operator;
		this.target = target;
		this.value = value;
	}

	public Operator getOperator() {
		return operator;
	}

	public JSExpression getTarget() {
		return target;
	}

	public JSExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, target, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSAssignmentExpression other = (JSAssignmentExpression) obj;
		return Objects.equals(operator, other.operator) &&
				Objects.equals(target, other.target) &&
				Objects.equals(value, other.value);
	}
}
