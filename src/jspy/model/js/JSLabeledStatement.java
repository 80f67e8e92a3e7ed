package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSLabeledStatement extends JSStatement {

	private final String label;
	private final JSStatement body;

	public JSLabeledStatement(SourceLocation location, String label, JSStatement body) {
		super(location);
		this.label = label;
		this.body = body;
	}

	public String getLabel() {
		return label;
	}

	public JSStatement getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSLabeledStatement other = (JSLabeledStatement) obj;
		return Objects.equals(label, other.label) &&
				Objects.equals(body, other.body);
	}
}
