package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Objects;

public class JSTryStatement extends JSStatement {

	private final JSBlockStatement block;
	private final JSIdentifier catchParameter;
	private final JSBlockStatement handler;
	private final JSBlockStatement finalizer;

	public JSTryStatement(SourceLocation location, JSBlockStatement block, JSIdentifier catchParameter, JSBlockStatement handler, JSBlockStatement finalizer) {
		super(location);
		this.block = block;
		this.catchParameter = catchParameter;
		this.handler = handler;
		this.finalizer = finalizer;
	}

	public JSBlockStatement getBlock() {
		return block;
	}

	public JSIdentifier getCatchParameter() {
		return catchParameter;
	}

	public JSBlockStatement getHandler() {
		return handler;
	}

	public JSBlockStatement getFinalizer() {
		return finalizer;
	}

	@Override
	public <T, E extends Throwable> T accept(JSStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(block, catchParameter, handler, finalizer);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		JSTryStatement other = (JSTryStatement) obj;
		return Objects.equals(block, other.block) &&
				Objects.equals(catchParameter, other.catchParameter) &&
				Objects.equals(handler, other.handler) &&
				Objects.equals(finalizer, other.finalizer);
	}
}
