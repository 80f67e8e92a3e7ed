package jspy.model.py;

import java.util.List;
import java.util.Objects;

public class PyFunctionDef extends PyStatement {

	private final String name;
	private final List<String> params;
	private final List<PyStatement> body;

	public PyFunctionDef(String name, List<String> params, List<PyStatement> body) {
		this.name = name;
		this.params = params;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<String> getParams() {
		return params;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyFunctionDef functionDef = (PyFunctionDef) o;
		return Objects.equals(name, functionDef.name) &&
				Objects.equals(params, functionDef.params) &&
				Objects.equals(body, functionDef.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, params, body);
	}
}
