package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSBreakStatement extends JSStatement {

	private final String label;

	public JSBreakStatement(SourceLocation location, String label) {
		super(location);
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSBreakStatement other = (JSBreakStatement) obj;
		return Objects.equals(label, other.label);
	}
}
