package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSStringLiteral extends JSExpression {

	private final String value;

	public JSStringLiteral(SourceLocation location, String value) {
		super(location);
		this.value = value;
	}

	public String getValue() {
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
		JSStringLiteral other = (JSStringLiteral) obj;
		return Objects.equals(value, other.value);
	}
}
