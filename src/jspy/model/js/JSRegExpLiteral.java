package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSRegExpLiteral extends JSExpression {

	private final String pattern;
	private final String flags;

	public JSRegExpLiteral(SourceLocation location, String pattern, String flags) {
		super(location);
		this.pattern = pattern;
		this.flags = flags;
	}

	public String getPattern() {
		return pattern;
	}

	public String getFlags() {
		return flags;
	}

	@Override
	public <T, E extends Throwable> T accept(JSExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pattern, flags);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSRegExpLiteral other = (JSRegExpLiteral) obj;
		return Objects.equals(pattern, other.pattern) &&
				Objects.equals(flags, other.flags);
	}
}
