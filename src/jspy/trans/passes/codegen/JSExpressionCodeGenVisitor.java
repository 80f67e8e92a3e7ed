package jspy.trans.passes.codegen;

import jspy.Unreachable;
import jspy.model.js.*;
import jspy.model.py.*;
import jspy.trans.issues.AmbiguousEvaluationContextIssue;
import jspy.trans.issues.UnsupportedConstructIssue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Translates a JavaScript expression evaluated for its value into a single Python expression.
 *
 * Side effects inside the expression are expressed with named expressions, so the result never needs
 * supporting statements.
 */
public class JSExpressionCodeGenVisitor extends JSExpressionVisitor<PyExpression, RuntimeException> {

	private final CodeGenContext ctx;

	public JSExpressionCodeGenVisitor(CodeGenContext ctx) {
		this.ctx = ctx;
	}

	public PyExpression translate(JSExpression expression) {
		return expression.accept(this);
	}

	public List<PyExpression> translateAll(List<JSExpression> expressions) {
		List<PyExpression> result = new ArrayList<>();
		for (JSExpression expression : expressions) {
			result.add(translate(expression));
		}
		return result;
	}

	public PyExpression truthy(JSExpression expression) {
		return ctx.callRuntime(PyRuntime.JS_TRUTHY, translate(expression));
	}

	/**
	 * @return the runtime helper implementing an arithmetic or equality operator
	 */
	public static String helperFor(JSNode node, JSBinaryExpression.Operator operator) {
		switch (operator) {
			case ADD:
				return PyRuntime.JS_ADD;
			case SUB:
				return PyRuntime.JS_SUB;
			case MUL:
				return PyRuntime.JS_MUL;
			case DIV:
				return PyRuntime.JS_DIV;
			case MOD:
				return PyRuntime.JS_MOD;
			case STRICT_EQ:
				return PyRuntime.JS_STRICT_EQ;
			case STRICT_NEQ:
				return PyRuntime.JS_STRICT_NEQ;
			case EQ:
				return PyRuntime.JS_LOOSE_EQ;
			case NEQ:
				return PyRuntime.JS_LOOSE_NEQ;
			default:
				throw new UnsupportedConstructIssue(node, "operator '" + operator.getSymbol() + "' is not supported",
						"rewrite the expression using arithmetic or comparison operators");
		}
	}

	/**
	 * Expressions whose evaluation has no side effects and whose value cannot be changed by evaluating them
	 * again: literals, identifiers and member reads of pure expressions.
	 */
	public static boolean isPure(JSExpression expression) {
		if (expression instanceof JSNumberLiteral || expression instanceof JSStringLiteral
				|| expression instanceof JSBooleanLiteral || expression instanceof JSNullLiteral
				|| expression instanceof JSIdentifier) {
			return true;
		}
		if (expression instanceof JSMemberExpression) {
			JSMemberExpression member = (JSMemberExpression) expression;
			return isPure(member.getObject()) && (!member.isComputed() || isPure(member.getProperty()));
		}
		return false;
	}

	/**
	 * @return the Python subscript key for a member access
	 */
	public PyExpression memberKey(JSMemberExpression memberExpression) {
		if (memberExpression.isComputed()) {
			return translate(memberExpression.getProperty());
		}
		return new PyStringLiteral(memberExpression.getPropertyName());
	}

	private static boolean isLengthAccess(JSMemberExpression memberExpression) {
		return !memberExpression.isComputed() && memberExpression.getPropertyName().equals("length");
	}

	private PyExpression updated(PyExpression current, boolean increment) {
		return ctx.callRuntime(increment ? PyRuntime.JS_ADD : PyRuntime.JS_SUB, current, new PyNumberLiteral(1));
	}

	@Override
	public PyExpression visit(JSNumberLiteral numberLiteral) {
		return new PyNumberLiteral(numberLiteral.getValue());
	}

	@Override
	public PyExpression visit(JSStringLiteral stringLiteral) {
		return new PyStringLiteral(stringLiteral.getValue());
	}

	@Override
	public PyExpression visit(JSBooleanLiteral booleanLiteral) {
		return booleanLiteral.getValue() ? PyBuiltins.True : PyBuiltins.False;
	}

	@Override
	public PyExpression visit(JSNullLiteral nullLiteral) {
		return PyBuiltins.None;
	}

	@Override
	public PyExpression visit(JSRegExpLiteral regExpLiteral) {
		return ctx.callRuntime(PyRuntime.COMPILE_JS_REGEX, new PyStringLiteral(regExpLiteral.getPattern()),
				new PyStringLiteral(regExpLiteral.getFlags()));
	}

	@Override
	public PyExpression visit(JSIdentifier identifier) {
		String name = identifier.getName();
		if (ctx.isKnownGlobal(name)) {
			switch (name) {
				case "undefined":
					return ctx.getSymbols().runtime(PyRuntime.JS_UNDEFINED);
				case "NaN":
					return new PyCall(PyBuiltins.Float, Collections.singletonList(new PyStringLiteral("nan")));
				case "Infinity":
					return new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), "inf");
				default:
					throw new UnsupportedConstructIssue(identifier, "'" + name + "' cannot be used as a value",
							"call one of its supported methods instead");
			}
		}
		return ctx.resolveBinding(identifier);
	}

	@Override
	public PyExpression visit(JSThis jsThis) {
		throw new UnsupportedConstructIssue(jsThis, "'this' is not supported",
				"pass the object as an explicit parameter");
	}

	@Override
	public PyExpression visit(JSArrayLiteral arrayLiteral) {
		List<PyExpression> elements = new ArrayList<>();
		for (JSExpression element : arrayLiteral.getElements()) {
			elements.add(element == null ? PyBuiltins.None : translate(element));
		}
		return new PyList(elements);
	}

	@Override
	public PyExpression visit(JSObjectLiteral objectLiteral) {
		List<PyDict.Entry> entries = new ArrayList<>();
		for (JSObjectProperty property : objectLiteral.getProperties()) {
			if (property.getPropertyKind() != JSObjectProperty.Kind.INIT) {
				throw new UnsupportedConstructIssue(property, "getters and setters are not supported",
						"store the computed value in a plain property");
			}
			entries.add(new PyDict.Entry(new PyStringLiteral(property.getKey()), translate(property.getValue())));
		}
		return new PyDict(entries);
	}

	@Override
	public PyExpression visit(JSMemberExpression memberExpression) {
		JSExpression object = memberExpression.getObject();
		if (object instanceof JSIdentifier && ctx.isKnownGlobal(((JSIdentifier) object).getName())) {
			return LibraryCallCodeGen.translateProperty(ctx, memberExpression);
		}
		if (isLengthAccess(memberExpression)) {
			return new PyCall(PyBuiltins.Len, Collections.singletonList(translate(object)));
		}
		return new PySubscript(translate(object), memberKey(memberExpression));
	}

	@Override
	public PyExpression visit(JSCallExpression callExpression) {
		PyExpression library = LibraryCallCodeGen.translateCall(ctx, this, callExpression);
		if (library != null) {
			return library;
		}
		return new PyCall(translate(callExpression.getCallee()), translateAll(callExpression.getArguments()));
	}

	@Override
	public PyExpression visit(JSNewExpression newExpression) {
		throw new UnsupportedConstructIssue(newExpression, "'new' is not supported",
				"build the object with an object literal");
	}

	@Override
	public PyExpression visit(JSUnaryExpression unaryExpression) {
		JSExpression argument = unaryExpression.getArgument();
		switch (unaryExpression.getOperator()) {
			case NOT:
				return new PyUnary(PyUnary.Operation.NOT, truthy(argument));
			case NEGATE:
				return new PyUnary(PyUnary.Operation.NEG, translate(argument));
			case PLUS:
				return ctx.callRuntime(PyRuntime.JS_TO_NUMBER, translate(argument));
			case TYPEOF:
				if (argument instanceof JSIdentifier) {
					String name = ((JSIdentifier) argument).getName();
					if (!ctx.getResolver().isDeclared(name) && !CodeGenContext.KNOWN_GLOBALS.contains(name)) {
						return new PyStringLiteral("undefined");
					}
				}
				return ctx.callRuntime(PyRuntime.JS_TYPEOF, translate(argument));
			case DELETE:
				if (argument instanceof JSMemberExpression) {
					JSMemberExpression member = (JSMemberExpression) argument;
					return ctx.callRuntime(PyRuntime.JS_DELETE, translate(member.getObject()), memberKey(member));
				}
				throw new UnsupportedConstructIssue(unaryExpression, "'delete' only applies to properties",
						"assign undefined to the variable instead");
			case BITWISE_NOT:
			case VOID:
				throw new UnsupportedConstructIssue(unaryExpression,
						"operator '" + unaryExpression.getOperator().getSymbol() + "' is not supported",
						"rewrite the expression without it");
			default:
				throw new Unreachable("unary operator " + unaryExpression.getOperator());
		}
	}

	@Override
	public PyExpression visit(JSUpdateExpression updateExpression) {
		JSExpression argument = updateExpression.getArgument();
		if (!(argument instanceof JSIdentifier)) {
			throw new AmbiguousEvaluationContextIssue(updateExpression,
					"update of a property cannot be used as a value",
					"move the update into its own statement");
		}
		PyName target = ctx.resolveBinding((JSIdentifier) argument);
		PyExpression number = ctx.callRuntime(PyRuntime.JS_TO_NUMBER, target);
		if (updateExpression.isPrefix()) {
			return new PyNamedExpr(target, updated(number, updateExpression.isIncrement()));
		}
		PyName old = ctx.freshTemp();
		return new PySubscript(
				new PyTuple(Arrays.asList(
						new PyNamedExpr(old, number),
						new PyNamedExpr(target, updated(old, updateExpression.isIncrement())))),
				new PyNumberLiteral(0));
	}

	@Override
	public PyExpression visit(JSBinaryExpression binaryExpression) {
		PyBinop.Operation comparison;
		switch (binaryExpression.getOperator()) {
			case LT:
				comparison = PyBinop.Operation.LT;
				break;
			case LE:
				comparison = PyBinop.Operation.LEQ;
				break;
			case GT:
				comparison = PyBinop.Operation.GT;
				break;
			case GE:
				comparison = PyBinop.Operation.GEQ;
				break;
			default:
				String helper = helperFor(binaryExpression, binaryExpression.getOperator());
				return ctx.callRuntime(helper, translate(binaryExpression.getLeft()),
						translate(binaryExpression.getRight()));
		}
		return new PyBinop(comparison, translate(binaryExpression.getLeft()), translate(binaryExpression.getRight()));
	}

	@Override
	public PyExpression visit(JSLogicalExpression logicalExpression) {
		PyName temp = ctx.freshTemp();
		PyExpression test = ctx.callRuntime(PyRuntime.JS_TRUTHY,
				new PyNamedExpr(temp, translate(logicalExpression.getLeft())));
		PyExpression right = translate(logicalExpression.getRight());
		switch (logicalExpression.getOperator()) {
			case AND:
				return new PyIfExp(test, right, temp);
			case OR:
				return new PyIfExp(test, temp, right);
			default:
				throw new Unreachable("logical operator " + logicalExpression.getOperator());
		}
	}

	@Override
	public PyExpression visit(JSConditionalExpression conditionalExpression) {
		PyExpression test = truthy(conditionalExpression.getTest());
		return new PyIfExp(test, translate(conditionalExpression.getConsequent()),
				translate(conditionalExpression.getAlternate()));
	}

	@Override
	public PyExpression visit(JSAssignmentExpression assignmentExpression) {
		if (!(assignmentExpression.getTarget() instanceof JSIdentifier)) {
			throw new AmbiguousEvaluationContextIssue(assignmentExpression,
					"assignment to a property cannot be used as a value",
					"move the assignment into its own statement");
		}
		PyName target = ctx.resolveBinding((JSIdentifier) assignmentExpression.getTarget());
		JSAssignmentExpression.Operator operator = assignmentExpression.getOperator();
		if (operator == JSAssignmentExpression.Operator.ASSIGN) {
			return new PyNamedExpr(target, translate(assignmentExpression.getValue()));
		}
		String helper = helperFor(assignmentExpression, operator.getBinaryOperator());
		return new PyNamedExpr(target, ctx.callRuntime(helper, target, translate(assignmentExpression.getValue())));
	}

	@Override
	public PyExpression visit(JSSequenceExpression sequenceExpression) {
		throw new AmbiguousEvaluationContextIssue(sequenceExpression,
				"comma expressions are only supported in for-loop init/update clauses and as statements",
				"split the expression into separate statements");
	}

	@Override
	public PyExpression visit(JSFunctionExpression functionExpression) {
		throw new UnsupportedConstructIssue(functionExpression, "function expressions are not supported",
				"declare the function with a function declaration");
	}
}
