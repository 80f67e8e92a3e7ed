package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSDoWhileStatement extends JSStatement {

	private final JSStatement body;
	private final JSExpression test;

	public JSDoWhileStatement(SourceLocation location, JSStatement body, JSExpression test) {
		super(location);
		this.body = body;
		this.test = test;
	}

	public JSStatement getBody() {
		return body;
	}

	public JSExpression getTest() {
		return test;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(body, test);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSDoWhileStatement other = (JSDoWhileStatement) obj;
		return Objects.equals(body, other.body) &&
				Objects.equals(test, other.test);
	}
}
