package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * One {@code name = init} entry of a declaration. {@code init} is null when absent.
 */
public class JSVariableDeclarator extends JSNode {

	private final JSIdentifier id;
	private final JSExpression init;

	public JSVariableDeclarator(SourceLocation location, JSIdentifier id, JSExpression init) {
		super(location);
		this.id = id;
		this.init = init;
	}

	public JSIdentifier getId() {
		return id;
	}

	public JSExpression getInit() {
		return init;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, init);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSVariableDeclarator other = (JSVariableDeclarator) obj;
		return Objects.equals(id, other.id) &&
				Objects.equals(init, other.init);
	}
}
