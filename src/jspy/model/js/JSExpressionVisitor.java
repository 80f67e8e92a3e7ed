package jspy.model.js;

public abstract class JSExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(JSNumberLiteral numberLiteral) throws E;
	public abstract T visit(JSStringLiteral stringLiteral) throws E;
	public abstract T visit(JSBooleanLiteral booleanLiteral) throws E;
	public abstract T visit(JSNullLiteral nullLiteral) throws E;
	public abstract T visit(JSRegExpLiteral regExpLiteral) throws E;
	public abstract T visit(JSIdentifier identifier) throws E;
	public abstract T visit(JSThis jsThis) throws E;
	public abstract T visit(JSArrayLiteral arrayLiteral) throws E;
	public abstract T visit(JSObjectLiteral objectLiteral) throws E;
	public abstract T visit(JSMemberExpression memberExpression) throws E;
	public abstract T visit(JSCallExpression callExpression) throws E;
	public abstract T visit(JSNewExpression newExpression) throws E;
	public abstract T visit(JSUnaryExpression unaryExpression) throws E;
	public abstract T visit(JSUpdateExpression updateExpression) throws E;
	public abstract T visit(JSBinaryExpression binaryExpression) throws E;
	public abstract T visit(JSLogicalExpression logicalExpression) throws E;
	public abstract T visit(JSConditionalExpression conditionalExpression) throws E;
	public abstract T visit(JSAssignmentExpression assignmentExpression) throws E;
	public abstract T visit(JSSequenceExpression sequenceExpression) throws E;
	public abstract T visit(JSFunctionExpression functionExpression) throws E;
}
