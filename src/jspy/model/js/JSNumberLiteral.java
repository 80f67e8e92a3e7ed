package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * A numeric literal. {@code text} keeps the literal as written.
 */
public class JSNumberLiteral extends JSExpression {

	private final double value;
	private final String text;

	public JSNumberLiteral(SourceLocation location, double value, String text) {
		super(location);
		this.value = value;
		this.text = text;
	}

	public double getValue() {
		return value;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, text);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSNumberLiteral other = (JSNumberLiteral) obj;
		return Double.compare(value, other.value) == 0 &&
				Objects.equals(text, other.text);
	}
}
