package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSFunctionDeclaration extends JSStatement {

	private final JSIdentifier name;
	private final List<JSIdentifier> params;
	private final List<JSStatement> body;

	public JSFunctionDeclaration(SourceLocation location, JSIdentifier name, List<JSIdentifier> params, List<JSStatement> body) {
		super(location);
		this.name = name;
		this.params = params;
		this.body = body;
	}

	public JSIdentifier getName() {
		return name;
	}

	public List<JSIdentifier> getParams() {
		return params;
	}

	public List<JSStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
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
		JSFunctionDeclaration other = (JSFunctionDeclaration) obj;
		return Objects.equals(name, other.name) &&
				Objects.equals(params, other.params) &&
				Objects.equals(body, other.body);
	}
}
