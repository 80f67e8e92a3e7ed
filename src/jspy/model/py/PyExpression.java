package jspy.model.py;

/**
 * A Python expression
 *
 */
public abstract class PyExpression extends PyNode {

	public abstract <T, E extends Throwable> T accept(PyExpressionVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
