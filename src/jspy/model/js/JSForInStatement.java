package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * Key enumeration {@code for (k in o) body}. Exactly one of {@code leftDeclaration} and {@code leftTarget} is set.
 */
public class JSForInStatement extends JSStatement {

	private final JSVariableDeclaration leftDeclaration;
	private final JSExpression leftTarget;
	private final JSExpression right;
	private final JSStatement body;

	public JSForInStatement(SourceLocation location, JSVariableDeclaration leftDeclaration, JSExpression leftTarget, JSExpression right, JSStatement body) {
		super(location);
		this.leftDeclaration = leftDeclaration;
		this.leftTarget = leftTarget;
		this.right = right;
		this.body = body;
	}

	public JSVariableDeclaration getLeftDeclaration() {
		return leftDeclaration;
	}

	public JSExpression getLeftTarget() {
		return leftTarget;
	}

	public JSExpression getRight() {
		return right;
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
		return Objects.hash(leftDeclaration, leftTarget, right, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSForInStatement other = (JSForInStatement) obj;
		return Objects.equals(leftDeclaration, other.leftDeclaration) &&
				Objects.equals(leftTarget, other.leftTarget) &&
				Objects.equals(right, other.right) &&
				Objects.equals(body, other.body);
	}
}
