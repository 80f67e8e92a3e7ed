package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSBooleanLiteral extends JSExpression {

	private final boolean value;

	public JSBooleanLiteral(SourceLocation location, boolean value) {
		super(location);
		this.value = value;
	}

	public boolean getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSBooleanLiteral other = (JSBooleanLiteral) obj;
		return value == other.value;
	}
}
