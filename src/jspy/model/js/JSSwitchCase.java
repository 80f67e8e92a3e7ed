package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A {@code case} clause, or the {@code default} clause when {@code test} is null.
 */
public class JSSwitchCase extends JSNode {

	private final JSExpression test;
	private final List<JSStatement> consequent;

	public JSSwitchCase(SourceLocation location, JSExpression test, List<JSStatement> consequent) {
		super(location);
		this.test = test;
		this.consequent = consequent;
	}

	public JSExpression getTest() {
		return test;
	}

	public List<JSStatement> getConsequent() {
		return consequent;
	}

	public boolean isDefault() {
		return test == null;
	}

	@Override
	public int hashCode() {
		return Objects.hash(test, consequent);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSSwitchCase other = (JSSwitchCase) obj;
		return Objects.equals(test, other.test) &&
				Objects.equals(consequent, other.consequent);
	}
}
