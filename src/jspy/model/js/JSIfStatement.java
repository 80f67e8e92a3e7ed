package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSIfStatement extends JSStatement {

	private final JSExpression test;
	private final JSStatement consequent;
	private final JSStatement alternate;

	public JSIfStatement(SourceLocation location, JSExpression test, JSStatement consequent, JSStatement alternate) {
		super(location);
		this.test = test;
		this.consequent = consequent;
		this.alternate = alternate;
	}

	public JSExpression getTest() {
		return test;
	}

	public JSStatement getConsequent() {
		return consequent;
	}

	public JSStatement getAlternate() {
		return alternate;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
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
		JSIfStatement other = (JSIfStatement) obj;
		return Objects.equals(test, other.test) &&
				Objects.equals(consequent, other.consequent) &&
				Objects.equals(alternate, other.alternate);
	}
}
