package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSBlockStatement extends JSStatement {

	private final List<JSStatement> body;

	public JSBlockStatement(SourceLocation location, List<JSStatement> body) {
		super(location);
		this.body = body;
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
		return Objects.hash(body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSBlockStatement other = (JSBlockStatement) obj;
		return Objects.equals(body, other.body);
	}
}
