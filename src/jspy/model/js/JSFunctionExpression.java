package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A function used as a value. The name is null for anonymous functions.
 */
public class JSFunctionExpression extends JSExpression {

	private final String name;
	private final List<JSIdentifier> params;
	private final List<JSStatement> body;

	public JSFunctionExpression(SourceLocation location, String name, List<JSIdentifier> params, List<JSStatement> body) {
		super(location);
		this.name = name;
		this.params = params;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<JSIdentifier> getParams() {
		return params;
	}

	public List<JSStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSFunctionExpression other = (JSFunctionExpression) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(params, other.params) &&
				Objects.equals(body, other.body);
	}
}
