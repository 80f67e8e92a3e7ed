package jspy.model.py;

public abstract class PyNodeVisitor<T, E extends Throwable> {

	public abstract T visit(PyModule module) throws E;
	public abstract T visit(PyStatement statement) throws E;
	public abstract T visit(PyExpression expression) throws E;
}
