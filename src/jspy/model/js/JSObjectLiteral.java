package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSObjectLiteral extends JSExpression {

	private final List<JSObjectProperty> properties;

	public JSObjectLiteral(SourceLocation location, List<JSObjectProperty> properties) {
		super(location);
		this.properties = properties;
	}

	public List<JSObjectProperty> getProperties() {
		return properties;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(properties);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSObjectLiteral other = (JSObjectLiteral) obj;
		return Objects.equals(properties, other.properties);
	}
}
