package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * Property access. For {@code o.p} the property is the identifier {@code p} and {@code computed} is false; for
 * {@code o[e]} it is the expression {@code e}.
 */
public class JSMemberExpression extends JSExpression {

	private final JSExpression object;
	private final JSExpression property;
	private final boolean computed;

	public JSMemberExpression(SourceLocation location, JSExpression object, JSExpression property, boolean computed) {
		super(location);
		this.object = object;
		this.property = property;
		this.computed = computed;
	}

	public JSExpression getObject() {
		return object;
	}

	public JSExpression getProperty() {
		return property;
	}

	public boolean isComputed() {
		return computed;
	}

	/**
	 * @return the property name of a non-computed access, or null for a computed one
	 */
	public String getPropertyName() {
		if (computed) {
			return null;
		}
		return ((JSIdentifier) property).getName();
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(object, property, computed);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSMemberExpression other = (JSMemberExpression) obj;
		return Objects.equals(object, other.object) &&
				Objects.equals(property, other.property) &&
				computed == other.computed;
	}
}
