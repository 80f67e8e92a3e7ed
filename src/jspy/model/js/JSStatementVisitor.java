package jspy.model.js;

public abstract class JSStatementVisitor<T, E extends Throwable> {
	public abstract T visit(JSExpressionStatement expressionStatement) throws E;
	public abstract T visit(JSVariableDeclaration variableDeclaration) throws E;
	public abstract T visit(JSFunctionDeclaration functionDeclaration) throws E;
	public abstract T visit(JSReturnStatement returnStatement) throws E;
	public abstract T visit(JSIfStatement ifStatement) throws E;
	public abstract T visit(JSBlockStatement blockStatement) throws E;
	public abstract T visit(JSWhileStatement whileStatement) throws E;
	public abstract T visit(JSDoWhileStatement doWhileStatement) throws E;
	public abstract T visit(JSForStatement forStatement) throws E;
	public abstract T visit(JSForInStatement forInStatement) throws E;
	public abstract T visit(JSSwitchStatement switchStatement) throws E;
	public abstract T visit(JSBreakStatement breakStatement) throws E;
	public abstract T visit(JSContinueStatement continueStatement) throws E;
	public abstract T visit(JSEmptyStatement emptyStatement) throws E;
	public abstract T visit(JSThrowStatement throwStatement) throws E;
	public abstract T visit(JSTryStatement tryStatement) throws E;
	public abstract T visit(JSLabeledStatement labeledStatement) throws E;
}
