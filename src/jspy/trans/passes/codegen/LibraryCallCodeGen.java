package jspy.trans.passes.codegen;

import jspy.model.js.*;
import jspy.model.py.*;
import jspy.trans.issues.AmbiguousEvaluationContextIssue;
import jspy.trans.issues.UnsupportedConstructIssue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Maps calls into the JavaScript standard library (Math, console, Date, string and array methods) onto Python
 * builtins, the standard library and runtime helpers.
 */
public final class LibraryCallCodeGen {

	private LibraryCallCodeGen() {}

	private static final List<String> MATH_FUNCTIONS = Arrays.asList(
			"floor", "ceil", "sqrt", "sin", "cos", "tan", "atan", "atan2", "log", "exp");

	/**
	 * Translates {@code Math.PI} and {@code Math.E}; any other property of a library object is rejected.
	 */
	public static PyExpression translateProperty(CodeGenContext ctx, JSMemberExpression memberExpression) {
		String object = ((JSIdentifier) memberExpression.getObject()).getName();
		if (object.equals("Math") && !memberExpression.isComputed()) {
			switch (memberExpression.getPropertyName()) {
				case "PI":
					return new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), "pi");
				case "E":
					return new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), "e");
			}
		}
		throw new UnsupportedConstructIssue(memberExpression, "unsupported library property " + describe(memberExpression),
				"only Math.PI and Math.E are available as values");
	}

	/**
	 * @return the translated call, or null if the callee is not a library function or method
	 */
	public static PyExpression translateCall(CodeGenContext ctx, JSExpressionCodeGenVisitor exprs,
	                                         JSCallExpression call) {
		if (!(call.getCallee() instanceof JSMemberExpression)) {
			return null;
		}
		JSMemberExpression callee = (JSMemberExpression) call.getCallee();
		if (callee.isComputed()) {
			return null;
		}
		JSExpression receiver = callee.getObject();
		if (receiver instanceof JSIdentifier && ctx.isKnownGlobal(((JSIdentifier) receiver).getName())) {
			switch (((JSIdentifier) receiver).getName()) {
				case "Math":
					return translateMath(ctx, exprs, call, callee.getPropertyName());
				case "console":
					if (callee.getPropertyName().equals("log")) {
						return new PyCall(ctx.getSymbols().runtime(PyRuntime.CONSOLE_LOG),
								exprs.translateAll(call.getArguments()));
					}
					break;
				case "Date":
					if (callee.getPropertyName().equals("now") && call.getArguments().isEmpty()) {
						return ctx.callRuntime(PyRuntime.JS_DATE_NOW);
					}
					break;
			}
			throw new UnsupportedConstructIssue(call, "unsupported library call " + describe(callee),
					"use one of the supported Math, console.log or Date.now functions");
		}
		return translateMethod(ctx, exprs, call, callee);
	}

	private static PyExpression translateMath(CodeGenContext ctx, JSExpressionCodeGenVisitor exprs,
	                                          JSCallExpression call, String function) {
		List<PyExpression> args = exprs.translateAll(call.getArguments());
		switch (function) {
			case "abs":
				requireArity(call, 1);
				return new PyCall(PyBuiltins.Abs, args);
			case "max":
				if (args.isEmpty()) {
					return new PyUnary(PyUnary.Operation.NEG,
							new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), "inf"));
				}
				return new PyCall(PyBuiltins.Max, args);
			case "min":
				if (args.isEmpty()) {
					return new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), "inf");
				}
				return new PyCall(PyBuiltins.Min, args);
			case "pow":
				requireArity(call, 2);
				return new PyBinop(PyBinop.Operation.POWER, args.get(0), args.get(1));
			case "round":
				requireArity(call, 1);
				return new PyCall(ctx.getSymbols().runtime(PyRuntime.JS_ROUND), args);
			case "random":
				requireArity(call, 0);
				return new PyCall(new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.RANDOM), "random"),
						args);
			default:
				if (MATH_FUNCTIONS.contains(function)) {
					requireArity(call, function.equals("atan2") ? 2 : 1);
					return new PyCall(new PyAttribute(ctx.getSymbols().stdlib(PyRuntime.StdlibModule.MATH), function),
							args);
				}
				throw new UnsupportedConstructIssue(call, "unsupported library call Math." + function,
						"implement the computation with supported Math functions");
		}
	}

	private static PyExpression translateMethod(CodeGenContext ctx, JSExpressionCodeGenVisitor exprs,
	                                            JSCallExpression call, JSMemberExpression callee) {
		List<JSExpression> args = call.getArguments();
		switch (callee.getPropertyName()) {
			case "charAt": {
				requireArity(call, 1);
				PyExpression receiver = exprs.translate(callee.getObject());
				JSExpression index = args.get(0);
				PyExpression lower;
				PyExpression reused;
				if (JSExpressionCodeGenVisitor.isPure(index)) {
					lower = exprs.translate(index);
					reused = lower;
				} else {
					PyName temp = ctx.freshTemp();
					lower = new PyNamedExpr(temp, exprs.translate(index));
					reused = temp;
				}
				return new PySlice(receiver, lower, new PyBinop(PyBinop.Operation.PLUS, reused, new PyNumberLiteral(1)));
			}
			case "charCodeAt":
				requireArity(call, 1);
				return ctx.callRuntime(PyRuntime.JS_CHAR_CODE_AT, exprs.translate(callee.getObject()),
						exprs.translate(args.get(0)));
			case "substring": {
				requireArity(call, 1, 2);
				PyExpression receiver = exprs.translate(callee.getObject());
				if (args.size() == 1) {
					return ctx.callRuntime(PyRuntime.JS_SUBSTRING, receiver, exprs.translate(args.get(0)));
				}
				return ctx.callRuntime(PyRuntime.JS_SUBSTRING, receiver, exprs.translate(args.get(0)),
						exprs.translate(args.get(1)));
			}
			case "toLowerCase":
				requireArity(call, 0);
				return methodCall(exprs.translate(callee.getObject()), "lower");
			case "toUpperCase":
				requireArity(call, 0);
				return methodCall(exprs.translate(callee.getObject()), "upper");
			case "trim":
				requireArity(call, 0);
				return methodCall(exprs.translate(callee.getObject()), "strip");
			case "indexOf":
				requireArity(call, 1);
				return methodCall(exprs.translate(callee.getObject()), "find", exprs.translate(args.get(0)));
			case "split":
				requireArity(call, 0, 1);
				if (args.isEmpty()) {
					return new PyList(Collections.singletonList(exprs.translate(callee.getObject())));
				}
				return methodCall(exprs.translate(callee.getObject()), "split", exprs.translate(args.get(0)));
			case "replace":
				requireArity(call, 2);
				if (args.get(0) instanceof JSRegExpLiteral) {
					throw new UnsupportedConstructIssue(call, "replace with a regular expression pattern is not supported",
							"replace a literal substring instead");
				}
				return methodCall(exprs.translate(callee.getObject()), "replace", exprs.translate(args.get(0)),
						exprs.translate(args.get(1)), new PyNumberLiteral(1));
			case "slice": {
				requireArity(call, 0, 2);
				PyExpression receiver = exprs.translate(callee.getObject());
				PyExpression lower = args.size() > 0 ? exprs.translate(args.get(0)) : null;
				PyExpression upper = args.size() > 1 ? exprs.translate(args.get(1)) : null;
				return new PySlice(receiver, lower, upper);
			}
			case "push":
				if (args.size() != 1) {
					throw new UnsupportedConstructIssue(call, "push with multiple arguments not supported",
							"push one element per call");
				}
				if (!(callee.getObject() instanceof JSArrayLiteral)) {
					throw new AmbiguousEvaluationContextIssue(call, "Cannot determine if receiver is an array",
							"only array literal receivers are translated to list append");
				}
				return methodCall(exprs.translate(callee.getObject()), "append", exprs.translate(args.get(0)));
			case "pop":
				requireArity(call, 0);
				return ctx.callRuntime(PyRuntime.JS_ARRAY_POP, exprs.translate(callee.getObject()));
			default:
				return null;
		}
	}

	private static PyCall methodCall(PyExpression receiver, String method, PyExpression... args) {
		return new PyCall(new PyAttribute(receiver, method), Arrays.asList(args));
	}

	private static void requireArity(JSCallExpression call, int arity) {
		requireArity(call, arity, arity);
	}

	private static void requireArity(JSCallExpression call, int min, int max) {
		int count = call.getArguments().size();
		if (count < min || count > max) {
			String expected = min == max ? Integer.toString(min) : min + " to " + max;
			throw new UnsupportedConstructIssue(call,
					describe((JSMemberExpression) call.getCallee()) + " called with " + count + " argument(s)",
					"call it with " + expected + " argument(s)");
		}
	}

	private static String describe(JSMemberExpression memberExpression) {
		String object = memberExpression.getObject() instanceof JSIdentifier
				? ((JSIdentifier) memberExpression.getObject()).getName()
				: "<expression>";
		if (memberExpression.isComputed()) {
			return object + "[...]";
		}
		return object + "." + memberExpression.getPropertyName();
	}
}
