package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * An array literal. Elided elements ({@code [1,,2]}) are represented by {@code null} entries.
 */
public class JSArrayLiteral extends JSExpression {

	private final List<JSExpression> elements;

	public JSArrayLiteral(SourceLocation location, List<JSExpression> elements) {
		super(location);
		this.elements = elements;
	}

	public List<JSExpression> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSArrayLiteral other = (JSArrayLiteral) obj;
		return Objects.equals(elements, other.elements);
	}
}
