package jspy.model.py;

public abstract class PyExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(PyName name) throws E;
	public abstract T visit(PyNumberLiteral numberLiteral) throws E;
	public abstract T visit(PyStringLiteral stringLiteral) throws E;
	public abstract T visit(PyList list) throws E;
	public abstract T visit(PyTuple tuple) throws E;
	public abstract T visit(PyDict dict) throws E;
	public abstract T visit(PySubscript subscript) throws E;
	public abstract T visit(PySlice slice) throws E;
	public abstract T visit(PyAttribute attribute) throws E;
	public abstract T visit(PyCall call) throws E;
	public abstract T visit(PyBinop binop) throws E;
	public abstract T visit(PyUnary unary) throws E;
	public abstract T visit(PyIfExp ifExp) throws E;
	public abstract T visit(PyNamedExpr namedExpr) throws E;
	public abstract T visit(PyBuiltins.BuiltinConstant builtinConstant) throws E;
}
