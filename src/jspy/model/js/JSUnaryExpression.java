package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSUnaryExpression extends JSExpression {

	public enum Operator {
		NOT("!"),
		NEGATE("-"),
		PLUS("+"),
		BITWISE_NOT("~"),
		TYPEOF("typeof"),
		DELETE("delete"),
		VOID("void");

		private final String symbol;

		Operator(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Operator operator;
	private final JSExpression argument;

	public JSUnaryExpression(SourceLocation location, Operator operator, JSExpression argument) {
		super(location);
		this.operator = operator;
		this.argument = argument;
	}

	public Operator getOperator() {
		return operator;
	}

	public JSExpression getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operator, argument);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSUnaryExpression other = (JSUnaryExpression) obj;
		return Objects.equals(operator, other.operator) &&
				Objects.equals(argument, other.argument);
	}
}
