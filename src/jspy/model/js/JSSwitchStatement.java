package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class JSSwitchStatement extends JSStatement {

	private final JSExpression discriminant;
	private final List<JSSwitchCase> cases;

	public JSSwitchStatement(SourceLocation location, JSExpression discriminant, List<JSSwitchCase> cases) {
		super(location);
		this.discriminant = discriminant;
		this.cases = cases;
	}

	public JSExpression getDiscriminant() {
		return discriminant;
	}

	public List<JSSwitchCase> getCases() {
		return cases;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(discriminant, cases);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSSwitchStatement other = (JSSwitchStatement) obj;
		return Objects.equals(discriminant, other.discriminant) &&
				Objects.equals(cases, other.cases);
	}
}
