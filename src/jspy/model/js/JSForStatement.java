package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * A counted loop {@code for (init; test; update) body}. At most one of {@code initDeclaration} and
 * {@code initExpression} is set; any of the three clauses may be null.
 */
public class JSForStatement extends JSStatement {

	private final JSVariableDeclaration initDeclaration;
	private final JSExpression initExpression;
	private final JSExpression test;
	private final JSExpression update;
	private final JSStatement body;

	public JSForStatement(SourceLocation location, JSVariableDeclaration initDeclaration, JSExpression initExpression, JSExpression test, JSExpression update, JSStatement body) {
		super(location);
		this.initDeclaration = initDeclaration;
		this.initExpression = initExpression;
		this.test = test;
		this.update = update;
		this.body = body;
	}

	public JSVariableDeclaration getInitDeclaration() {
		return initDeclaration;
	}

	public JSExpression getInitExpression() {
		return initExpression;
	}

	public JSExpression getTest() {
		return test;
	}

	public JSExpression getUpdate() {
		return update;
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
		return Objects.hash(initDeclaration, initExpression, test, update, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSForStatement other = (JSForStatement) obj;
		return Objects.equals(initDeclaration, other.initDeclaration) &&
				Objects.equals(initExpression, other.initExpression) &&
				Objects.equals(test, other.test) &&
				Objects.equals(update, other.update) &&
				Objects.equals(body, other.body);
	}
}
