package jspy.model.py;

import java.util.List;
import java.util.Objects;

/**
 * {@code global a, b} or, for names of an enclosing function, {@code nonlocal a, b}.
 */
public class PyGlobal extends PyStatement {

	private final List<String> names;
	private final boolean nonlocal;

	public PyGlobal(List<String> names, boolean nonlocal) {
		this.names = names;
		this.nonlocal = nonlocal;
	}

	public List<String> getNames() {
		return names;
	}

	public boolean isNonlocal() {
		return nonlocal;
	}

	@Override
	public <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyGlobal global = (PyGlobal) o;
		return Objects.equals(names, global.names) &&
				nonlocal == global.nonlocal;
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, nonlocal);
	}
}
