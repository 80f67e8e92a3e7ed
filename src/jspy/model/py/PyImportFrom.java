package jspy.model.py;

import java.util.List;
import java.util.Objects;

/**
 * {@code from module import a, b}
 */
public class PyImportFrom extends PyStatement {

	private final String module;
	private final List<String> names;

	public PyImportFrom(String module, List<String> names) {
		this.module = module;
		this.names = names;
	}

	public String getModule() {
		return module;
	}

	public List<String> getNames() {
		return names;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyImportFrom importFrom = (PyImportFrom) o;
		return Objects.equals(module, importFrom.module) &&
				Objects.equals(names, importFrom.names);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, names);
	}
}
