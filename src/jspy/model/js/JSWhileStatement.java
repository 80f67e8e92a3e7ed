package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSWhileStatement extends JSStatement {

	private final JSExpression test;
	private final JSStatement body;

	public JSWhileStatement(SourceLocation location, JSExpression test, JSStatement body) {
		super(location);
		this.test = test;
		this.body = body;
	}

	public JSExpression getTest() {
		return test;
	}

	public JSStatement getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSWhileStatement other = (JSWhileStatement) obj;
		return Objects.equals(test, other.test) &&
				Objects.equals(body, other.body);
	}
}
