package jspy.model.py;

/**
 * A Python statement
 *
 */
public abstract class PyStatement extends PyNode {

	public abstract <T, E extends Throwable> T accept(PyStatementVisitor<T, E> v) throws E;

	@Override
	public <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
