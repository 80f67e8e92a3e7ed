package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSIdentifier extends JSExpression {

	private final String name;

	public JSIdentifier(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSIdentifier other = (JSIdentifier) obj;
		return Objects.equals(name, other.name);
	}
}
