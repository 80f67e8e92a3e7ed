package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed compilation unit.
 */
public class JSProgram extends JSNode {

	private final List<JSStatement> body;

	public JSProgram(SourceLocation location, List<JSStatement> body) {
		super(location);
		this.body = body;
	}

	public List<JSStatement> getBody() {
		return body;
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
		JSProgram other = (JSProgram) obj;
		return Objects.equals(body, other.body);
	}
}
