package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * A return statement. The argument is null for a bare {@code return;}.
 */
public class JSReturnStatement extends JSStatement {

	private final JSExpression argument;

	public JSReturnStatement(SourceLocation location, JSExpression argument) {
		super(location);
		this.argument = argument;
	}

	public JSExpression getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(argument);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSReturnStatement other = (JSReturnStatement) obj;
		return Objects.equals(argument, other.argument);
	}
}
