package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

/**
 * {@code ++x}, {@code x++}, {@code --x} and {@code x--}.
 */
public class JSUpdateExpression extends JSExpression {

	private final boolean increment;
	private final boolean prefix;
	private final JSExpression argument;

	public JSUpdateExpression(SourceLocation location, boolean increment, boolean prefix, JSExpression argument) {
		super(location);
		this.increment = increment;
		this.prefix = prefix;
		this.argument = argument;
	}

	public boolean isIncrement() {
		return increment;
	}

	public boolean isPrefix() {
		return prefix;
	}

	public JSExpression getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(increment, prefix, argument);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSUpdateExpression other = (JSUpdateExpression) obj;
		return increment == other.increment &&
				prefix == other.prefix &&
				Objects.equals(argument, other.argument);
	}
}
