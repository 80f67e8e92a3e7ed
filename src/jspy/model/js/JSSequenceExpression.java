package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * The comma operator, {@code a, b, c}.
 */
public class JSSequenceExpression extends JSExpression {

	private final List<JSExpression> expressions;

	public JSSequenceExpression(SourceLocation location, List<JSExpression> expressions) {
		super(location);
		this.expressions = expressions;
	}

	public List<JSExpression> getExpressions() {
		return expressions;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(expressions);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSSequenceExpression other = (JSSequenceExpression) obj;
		return Objects.equals(expressions, other.expressions);
	}
}
