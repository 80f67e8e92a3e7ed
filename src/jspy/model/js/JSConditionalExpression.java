package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSConditionalExpression extends JSExpression {

	private final JSExpression test;
	private final JSExpression consequent;
	private final JSExpression alternate;

	public JSConditionalExpression(SourceLocation location, JSExpression test, JSExpression consequent, JSExpression alternate) {
		super(location);
		this.test = test;
		this.consequent = consequent;
		this.alternate = alternate;
	}

	public JSExpression getTest() {
		return test;
	}

	public JSExpression getConsequent() {
		return consequent;
	}

	public JSExpression getAlternate() {
		return alternate;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, consequent, alternate);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSConditionalExpression other = (JSConditionalExpression) obj;
		return Objects.equals(test, other.test) &&
				Objects.equals(consequent, other.consequent) &&
				Objects.equals(alternate, other.alternate);
	}
}
