package jspy.model.js;

import jspy.util.SourceLocation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class JSBuilder {
	private JSBuilder() {}

	public static JSProgram program(JSStatement... body) {
		return new JSProgram(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static JSIdentifier id(String name) {
		return new JSIdentifier(SourceLocation.unknown(), name);
	}

	// text as the literal would be written in source
	public static JSNumberLiteral num(double value) {
		String text = value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
		return new JSNumberLiteral(SourceLocation.unknown(), value, text);
	}

	public static JSStringLiteral str(String value) {
		return new JSStringLiteral(SourceLocation.unknown(), value);
	}

	public static JSBooleanLiteral bool(boolean value) {
		return new JSBooleanLiteral(SourceLocation.unknown(), value);
	}

	public static JSExpressionStatement exprStmt(JSExpression expression) {
		return new JSExpressionStatement(SourceLocation.unknown(), expression);
	}

	public static JSAssignmentExpression assign(JSExpression target, JSExpression value) {
		return new JSAssignmentExpression(SourceLocation.unknown(), JSAssignmentExpression.Operator.ASSIGN, target,
				value);
	}

	public static JSCallExpression call(JSExpression callee, JSExpression... arguments) {
		return new JSCallExpression(SourceLocation.unknown(), callee, Arrays.asList(arguments));
	}

	public static JSVariableDeclaration var(String name, JSExpression init) {
		return new JSVariableDeclaration(SourceLocation.unknown(), JSVariableDeclaration.Kind.VAR,
				Collections.singletonList(new JSVariableDeclarator(SourceLocation.unknown(), id(name), init)));
	}

	public static JSBlockStatement block(JSStatement... body) {
		return new JSBlockStatement(SourceLocation.unknown(), Arrays.asList(body));
	}

	public static JSWhileStatement whileLoop(JSExpression test, JSStatement body) {
		return new JSWhileStatement(SourceLocation.unknown(), test, body);
	}

	public static JSForStatement forLoop(JSExpression init, JSExpression test, JSExpression update, JSStatement body) {
		return new JSForStatement(SourceLocation.unknown(), null, init, test, update, body);
	}

	public static JSIfStatement ifStmt(JSExpression test, JSStatement consequent, JSStatement alternate) {
		return new JSIfStatement(SourceLocation.unknown(), test, consequent, alternate);
	}

	public static JSBreakStatement breakStmt() {
		return new JSBreakStatement(SourceLocation.unknown(), null);
	}

	public static JSBreakStatement breakStmt(String label) {
		return new JSBreakStatement(SourceLocation.unknown(), label);
	}

	public static JSContinueStatement continueStmt() {
		return new JSContinueStatement(SourceLocation.unknown(), null);
	}

	public static JSContinueStatement continueStmt(String label) {
		return new JSContinueStatement(SourceLocation.unknown(), label);
	}

	public static JSReturnStatement returnStmt(JSExpression argument) {
		return new JSReturnStatement(SourceLocation.unknown(), argument);
	}

	public static JSLabeledStatement labeled(String label, JSStatement body) {
		return new JSLabeledStatement(SourceLocation.unknown(), label, body);
	}

	public static JSSwitchStatement switchStmt(JSExpression discriminant, JSSwitchCase... cases) {
		return new JSSwitchStatement(SourceLocation.unknown(), discriminant, Arrays.asList(cases));
	}

	public static JSSwitchCase caseOf(JSExpression test, JSStatement... consequent) {
		return new JSSwitchCase(SourceLocation.unknown(), test, Arrays.asList(consequent));
	}

	public static JSSwitchCase defaultCase(JSStatement... consequent) {
		return new JSSwitchCase(SourceLocation.unknown(), null, Arrays.asList(consequent));
	}

	public static JSFunctionDeclaration function(String name, List<String> params, JSStatement... body) {
		JSIdentifier[] ids = params.stream().map(JSBuilder::id).toArray(JSIdentifier[]::new);
		return new JSFunctionDeclaration(SourceLocation.unknown(), id(name), Arrays.asList(ids), Arrays.asList(body));
	}
}
