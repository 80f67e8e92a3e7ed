package jspy.model.py;

public abstract class PyStatementVisitor<T, E extends Throwable> {
	public abstract T visit(PyAssignment assignment) throws E;
	public abstract T visit(PyExpressionStatement expressionStatement) throws E;
	public abstract T visit(PyIf pyIf) throws E;
	public abstract T visit(PyWhile pyWhile) throws E;
	public abstract T visit(PyFor pyFor) throws E;
	public abstract T visit(PyBreak pyBreak) throws E;
	public abstract T visit(PyContinue pyContinue) throws E;
	public abstract T visit(PyReturn pyReturn) throws E;
	public abstract T visit(PyFunctionDef functionDef) throws E;
	public abstract T visit(PyGlobal global) throws E;
	public abstract T visit(PyImport pyImport) throws E;
	public abstract T visit(PyImportFrom importFrom) throws E;
}
