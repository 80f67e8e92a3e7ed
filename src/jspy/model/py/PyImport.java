package jspy.model.py;

import java.util.Objects;

/**
 * {@code import module as alias}
 */
public class PyImport extends PyStatement {

	private final String module;
	private final String alias;

	public PyImport(String module, String alias) {
		this.module = module;
		this.alias = alias;
	}

	public String getModule() {
		return module;
	}

	public String getAlias() {
		return alias;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyImport that = (PyImport) o;
		return Objects.equals(module, that.module) &&
				Objects.equals(alias, that.alias);
	}

	@Override
	public int hashCode() {
		return Objects.hash(module, alias);
	}
}
