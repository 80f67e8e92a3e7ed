package jspy.model.py;

import java.util.List;
import java.util.Objects;

/**
 * A dict display. Entries keep their insertion order.
 */
public class PyDict extends PyExpression {

	public static class Entry {
		private final PyExpression key;
		private final PyExpression value;

		public Entry(PyExpression key, PyExpression value) {
			this.key = key;
			this.value = value;
		}

		public PyExpression getKey() {
			return key;
		}

		public PyExpression getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			Entry entry = (Entry) o;
			return Objects.equals(key, entry.key) && Objects.equals(value, entry.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(key, value);
		}
	}

	private final List<Entry> entries;

	public PyDict(List<Entry> entries) {
		this.entries = entries;
	}

	public List<Entry> getEntries() {
		return entries;
	}

	@Override
	public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		PyDict dict = (PyDict) o;
		return Objects.equals(entries, dict.entries);
	}

	@Override
	public int hashCode() {
		return Objects.hash(entries);
	}
}
