package jspy.model.py;

import java.util.List;
import java.util.Objects;

/**
 * Root of a generated Python file. Import statements, when present, come first in the body.
 */
public class PyModule extends PyNode {

	private final String name;
	private final List<PyStatement> body;

	public PyModule(String name, List<PyStatement> body) {
		this.name = name;
		this.body = body;
	}

	public String getName() {
		return name;
	}

	public List<PyStatement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyModule module = (PyModule) o;
		return Objects.equals(name, module.name) &&
				Objects.equals(body, module.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, body);
	}
}
