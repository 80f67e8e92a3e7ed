package jspy.model.py;

import java.util.Objects;

public final class PyBuiltins {

	private PyBuiltins() {}

	public static class BuiltinConstant extends PyExpression {
		private final String value;

		public BuiltinConstant(String value) {
			this.value = value;
		}

		public String getValue() {
			return value;
		}

		@Override
		public <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> visitor) throws E {
			return visitor.visit(this);
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			BuiltinConstant that = (BuiltinConstant) o;
			return Objects.equals(value, that.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(value);
		}
	}

	public static final BuiltinConstant None = new BuiltinConstant("None");
	public static final BuiltinConstant True = new BuiltinConstant("True");
	public static final BuiltinConstant False = new BuiltinConstant("False");

	public static final PyName Len = new PyName("len");
	public static final PyName Abs = new PyName("abs");
	public static final PyName Max = new PyName("max");
	public static final PyName Min = new PyName("min");
	public static final PyName Float = new PyName("float");

}
