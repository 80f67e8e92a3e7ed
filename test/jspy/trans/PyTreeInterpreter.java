package jspy.trans;

import jspy.model.py.*;

import java.util.*;

/**
 * Executes a generated Python tree against a Java model of the runtime library, so that translations can be checked
 * by the values they compute rather than by their text.
 *
 * Only the statement and expression forms the code generator emits are supported. Numbers are doubles, JavaScript
 * objects are insertion-ordered maps and arrays are lists.
 */
public class PyTreeInterpreter {

	public static final Object UNDEFINED = new Object() {
		@Override
		public String toString() {
			return "JSUndefined";
		}
	};

	public static final Object NONE = new Object() {
		@Override
		public String toString() {
			return "None";
		}
	};

	public interface PyCallable {
		Object call(List<Object> args);
	}

	private enum Signal {
		NORMAL,
		BREAK,
		CONTINUE,
		RETURN,
	}

	private static final class Frame {
		final Map<String, Object> locals = new HashMap<>();
		final Frame enclosing;
		final boolean isFunction;
		final Set<String> globals = new HashSet<>();
		final Set<String> nonlocals = new HashSet<>();
		Object returnValue = NONE;

		Frame(Frame enclosing, boolean isFunction) {
			this.enclosing = enclosing;
			this.isFunction = isFunction;
		}
	}

	private final Frame module = new Frame(null, false);
	private final Map<String, Object> builtins = new HashMap<>();
	private final Map<String, Object> runtime = new HashMap<>();
	private final Map<String, Map<String, Object>> stdlib = new HashMap<>();
	private final Map<String, Integer> reads = new HashMap<>();
	private final Map<String, Integer> writes = new HashMap<>();
	private final List<String> console = new ArrayList<>();

	public PyTreeInterpreter() {
		builtins.put("len", (PyCallable) args -> {
			Object value = args.get(0);
			if (value instanceof String) {
				return (double) ((String) value).length();
			}
			if (value instanceof List) {
				return (double) ((List<?>) value).size();
			}
			return (double) ((Map<?, ?>) value).size();
		});
		builtins.put("abs", (PyCallable) args -> Math.abs(num(args.get(0))));
		builtins.put("max", (PyCallable) args -> {
			double result = Double.NEGATIVE_INFINITY;
			for (Object arg : args) {
				result = Math.max(result, num(arg));
			}
			return result;
		});
		builtins.put("min", (PyCallable) args -> {
			double result = Double.POSITIVE_INFINITY;
			for (Object arg : args) {
				result = Math.min(result, num(arg));
			}
			return result;
		});
		builtins.put("float", (PyCallable) args -> {
			String text = (String) args.get(0);
			switch (text) {
				case "nan":
					return Double.NaN;
				case "inf":
					return Double.POSITIVE_INFINITY;
				default:
					return Double.parseDouble(text);
			}
		});

		runtime.put(PyRuntime.JS_UNDEFINED, UNDEFINED);
		runtime.put(PyRuntime.JS_TRUTHY, (PyCallable) args -> jsTruthy(args.get(0)));
		runtime.put(PyRuntime.JS_TO_NUMBER, (PyCallable) args -> toNumber(args.get(0)));
		runtime.put(PyRuntime.JS_STRICT_EQ, (PyCallable) args -> strictEquals(args.get(0), args.get(1)));
		runtime.put(PyRuntime.JS_STRICT_NEQ, (PyCallable) args -> !strictEquals(args.get(0), args.get(1)));
		runtime.put(PyRuntime.JS_LOOSE_EQ, (PyCallable) args -> looseEquals(args.get(0), args.get(1)));
		runtime.put(PyRuntime.JS_LOOSE_NEQ, (PyCallable) args -> !looseEquals(args.get(0), args.get(1)));
		runtime.put(PyRuntime.JS_ADD, (PyCallable) args -> {
			Object a = args.get(0);
			Object b = args.get(1);
			if (a instanceof String || b instanceof String) {
				return toJSString(a) + toJSString(b);
			}
			return toNumber(a) + toNumber(b);
		});
		runtime.put(PyRuntime.JS_SUB, (PyCallable) args -> toNumber(args.get(0)) - toNumber(args.get(1)));
		runtime.put(PyRuntime.JS_MUL, (PyCallable) args -> toNumber(args.get(0)) * toNumber(args.get(1)));
		runtime.put(PyRuntime.JS_DIV, (PyCallable) args -> toNumber(args.get(0)) / toNumber(args.get(1)));
		runtime.put(PyRuntime.JS_MOD, (PyCallable) args -> toNumber(args.get(0)) % toNumber(args.get(1)));
		runtime.put(PyRuntime.JS_TYPEOF, (PyCallable) args -> typeOf(args.get(0)));
		runtime.put(PyRuntime.JS_FOR_IN_KEYS, (PyCallable) args -> {
			List<Object> keys = new ArrayList<>();
			Object target = args.get(0);
			if (target instanceof Map) {
				keys.addAll(((Map<?, ?>) target).keySet());
			} else if (target instanceof List) {
				for (int i = 0; i < ((List<?>) target).size(); i++) {
					keys.add(Integer.toString(i));
				}
			}
			return keys;
		});
		runtime.put(PyRuntime.CONSOLE_LOG, (PyCallable) args -> {
			StringJoiner line = new StringJoiner(" ");
			for (Object arg : args) {
				line.add(toJSString(arg));
			}
			console.add(line.toString());
			return NONE;
		});

		Map<String, Object> math = new HashMap<>();
		math.put("inf", Double.POSITIVE_INFINITY);
		math.put("floor", (PyCallable) args -> Math.floor(num(args.get(0))));
		math.put("ceil", (PyCallable) args -> Math.ceil(num(args.get(0))));
		math.put("sqrt", (PyCallable) args -> Math.sqrt(num(args.get(0))));
		stdlib.put("math", math);
	}

	public void run(PyModule pyModule) {
		Executor executor = new Executor(module);
		for (PyStatement statement : pyModule.getBody()) {
			if (statement.accept(executor) != Signal.NORMAL) {
				throw new IllegalStateException("control flow escaped the module body");
			}
		}
	}

	public Object global(String name) {
		if (!module.locals.containsKey(name)) {
			throw new NoSuchElementException("no module global " + name);
		}
		return module.locals.get(name);
	}

	public Object call(String function, Object... args) {
		return ((PyCallable) global(function)).call(Arrays.asList(args));
	}

	public int readCount(String name) {
		return reads.getOrDefault(name, 0);
	}

	public int writeCount(String name) {
		return writes.getOrDefault(name, 0);
	}

	public List<String> getConsoleOutput() {
		return Collections.unmodifiableList(console);
	}

	// runtime model

	private static double num(Object value) {
		return (Double) value;
	}

	static boolean jsTruthy(Object value) {
		if (value == UNDEFINED || value == NONE) {
			return false;
		}
		if (value instanceof Boolean) {
			return (Boolean) value;
		}
		if (value instanceof Double) {
			double d = (Double) value;
			return d != 0 && !Double.isNaN(d);
		}
		if (value instanceof String) {
			return !((String) value).isEmpty();
		}
		return true;
	}

	private static boolean pyTruthy(Object value) {
		if (value == UNDEFINED) {
			return true;
		}
		if (value instanceof List) {
			return !((List<?>) value).isEmpty();
		}
		if (value instanceof Map) {
			return !((Map<?, ?>) value).isEmpty();
		}
		return jsTruthy(value);
	}

	static double toNumber(Object value) {
		if (value instanceof Double) {
			return (Double) value;
		}
		if (value instanceof Boolean) {
			return (Boolean) value ? 1 : 0;
		}
		if (value == NONE) {
			return 0;
		}
		if (value instanceof String) {
			String text = ((String) value).trim();
			if (text.isEmpty()) {
				return 0;
			}
			try {
				return Double.parseDouble(text);
			} catch (NumberFormatException e) {
				return Double.NaN;
			}
		}
		return Double.NaN;
	}

	static String toJSString(Object value) {
		if (value instanceof Double) {
			double d = (Double) value;
			if (d == Math.rint(d) && !Double.isInfinite(d)) {
				return Long.toString((long) d);
			}
			return Double.toString(d);
		}
		if (value == NONE) {
			return "null";
		}
		if (value == UNDEFINED) {
			return "undefined";
		}
		return String.valueOf(value);
	}

	private static boolean strictEquals(Object a, Object b) {
		if (a instanceof Double && b instanceof Double) {
			return ((Double) a).doubleValue() == (Double) b;
		}
		if (a instanceof String || a instanceof Boolean) {
			return a.equals(b);
		}
		return a == b;
	}

	private static boolean looseEquals(Object a, Object b) {
		boolean aNullish = a == NONE || a == UNDEFINED;
		boolean bNullish = b == NONE || b == UNDEFINED;
		if (aNullish || bNullish) {
			return aNullish && bNullish;
		}
		if (a.getClass() == b.getClass()) {
			return strictEquals(a, b);
		}
		boolean aPrimitive = a instanceof Double || a instanceof String || a instanceof Boolean;
		boolean bPrimitive = b instanceof Double || b instanceof String || b instanceof Boolean;
		if (aPrimitive && bPrimitive) {
			return toNumber(a) == toNumber(b);
		}
		return false;
	}

	private static String typeOf(Object value) {
		if (value == UNDEFINED) {
			return "undefined";
		}
		if (value instanceof Double) {
			return "number";
		}
		if (value instanceof String) {
			return "string";
		}
		if (value instanceof Boolean) {
			return "boolean";
		}
		if (value instanceof PyCallable) {
			return "function";
		}
		return "object";
	}

	private static boolean pyEquals(Object a, Object b) {
		if (a instanceof Double && b instanceof Double) {
			return ((Double) a).doubleValue() == (Double) b;
		}
		return Objects.equals(a, b);
	}

	@SuppressWarnings("unchecked")
	private static int compare(Object a, Object b) {
		if (a instanceof Double && b instanceof Double) {
			return Double.compare((Double) a, (Double) b);
		}
		return ((Comparable<Object>) a).compareTo(b);
	}

	// name resolution

	private static void count(Map<String, Integer> counts, String name) {
		counts.merge(name, 1, Integer::sum);
	}

	private Frame owner(Frame frame, String name) {
		if (frame.isFunction && frame.globals.contains(name)) {
			return module;
		}
		if (frame.isFunction && frame.nonlocals.contains(name)) {
			for (Frame outer = frame.enclosing; outer != null && outer.isFunction; outer = outer.enclosing) {
				if (outer.locals.containsKey(name)) {
					return outer;
				}
			}
			throw new IllegalStateException("no binding for nonlocal " + name);
		}
		return frame;
	}

	private Object load(Frame frame, String name) {
		count(reads, name);
		for (Frame scope = owner(frame, name); scope != null; scope = scope.enclosing) {
			if (scope.locals.containsKey(name)) {
				return scope.locals.get(name);
			}
		}
		if (builtins.containsKey(name)) {
			return builtins.get(name);
		}
		throw new IllegalStateException("name '" + name + "' is not defined");
	}

	private void store(Frame frame, String name, Object value) {
		count(writes, name);
		owner(frame, name).locals.put(name, value);
	}

	private final class UserFunction implements PyCallable {
		private final PyFunctionDef definition;
		private final Frame closure;

		UserFunction(PyFunctionDef definition, Frame closure) {
			this.definition = definition;
			this.closure = closure;
		}

		@Override
		public Object call(List<Object> args) {
			List<String> params = definition.getParams();
			if (params.size() != args.size()) {
				throw new IllegalArgumentException(definition.getName() + "() takes " + params.size() +
						" arguments but " + args.size() + " were given");
			}
			Frame frame = new Frame(closure, true);
			for (int i = 0; i < params.size(); i++) {
				frame.locals.put(params.get(i), args.get(i));
			}
			new Executor(frame).block(definition.getBody());
			return frame.returnValue;
		}
	}

	private final class Executor extends PyStatementVisitor<Signal, RuntimeException> {
		private final Frame frame;
		private final Evaluator evaluator;

		Executor(Frame frame) {
			this.frame = frame;
			this.evaluator = new Evaluator(frame);
		}

		Signal block(List<PyStatement> statements) {
			for (PyStatement statement : statements) {
				Signal signal = statement.accept(this);
				if (signal != Signal.NORMAL) {
					return signal;
				}
			}
			return Signal.NORMAL;
		}

		private Object eval(PyExpression expression) {
			return expression.accept(evaluator);
		}

		@Override
		public Signal visit(PyAssignment assignment) {
			evaluator.assign(assignment.getTarget(), assignment.getValue());
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyExpressionStatement expressionStatement) {
			eval(expressionStatement.getExpression());
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyIf pyIf) {
			if (pyTruthy(eval(pyIf.getCondition()))) {
				return block(pyIf.getBody());
			}
			return block(pyIf.getOrElse());
		}

		@Override
		public Signal visit(PyWhile pyWhile) {
			while (pyTruthy(eval(pyWhile.getCondition()))) {
				Signal signal = block(pyWhile.getBody());
				if (signal == Signal.BREAK) {
					break;
				}
				if (signal == Signal.RETURN) {
					return signal;
				}
			}
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyFor pyFor) {
			Object iterable = eval(pyFor.getIterable());
			List<Object> items = new ArrayList<>();
			if (iterable instanceof List) {
				items.addAll((List<?>) iterable);
			} else if (iterable instanceof Map) {
				items.addAll(((Map<?, ?>) iterable).keySet());
			} else {
				for (char c : ((String) iterable).toCharArray()) {
					items.add(String.valueOf(c));
				}
			}
			String target = ((PyName) pyFor.getTarget()).getName();
			for (Object item : items) {
				store(frame, target, item);
				Signal signal = block(pyFor.getBody());
				if (signal == Signal.BREAK) {
					break;
				}
				if (signal == Signal.RETURN) {
					return signal;
				}
			}
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyBreak pyBreak) {
			return Signal.BREAK;
		}

		@Override
		public Signal visit(PyContinue pyContinue) {
			return Signal.CONTINUE;
		}

		@Override
		public Signal visit(PyReturn pyReturn) {
			if (!frame.isFunction) {
				throw new IllegalStateException("'return' outside function");
			}
			frame.returnValue = pyReturn.getValue() == null ? NONE : eval(pyReturn.getValue());
			return Signal.RETURN;
		}

		@Override
		public Signal visit(PyFunctionDef functionDef) {
			store(frame, functionDef.getName(), new UserFunction(functionDef, frame));
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyGlobal global) {
			if (!frame.isFunction) {
				throw new IllegalStateException("declaration outside function");
			}
			(global.isNonlocal() ? frame.nonlocals : frame.globals).addAll(global.getNames());
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyImport pyImport) {
			Map<String, Object> imported = stdlib.get(pyImport.getModule());
			if (imported == null) {
				throw new IllegalStateException("no model of module " + pyImport.getModule());
			}
			frame.locals.put(pyImport.getAlias() == null ? pyImport.getModule() : pyImport.getAlias(), imported);
			return Signal.NORMAL;
		}

		@Override
		public Signal visit(PyImportFrom importFrom) {
			for (String name : importFrom.getNames()) {
				if (!runtime.containsKey(name)) {
					throw new IllegalStateException("no model of runtime symbol " + name);
				}
				frame.locals.put(name, runtime.get(name));
			}
			return Signal.NORMAL;
		}
	}

	private final class Evaluator extends PyExpressionVisitor<Object, RuntimeException> {
		private final Frame frame;

		Evaluator(Frame frame) {
			this.frame = frame;
		}

		private Object eval(PyExpression expression) {
			return expression.accept(this);
		}

		@SuppressWarnings("unchecked")
		void assign(PyExpression target, PyExpression valueExpression) {
			if (target instanceof PyName) {
				store(frame, ((PyName) target).getName(), eval(valueExpression));
				return;
			}
			if (!(target instanceof PySubscript)) {
				throw new IllegalArgumentException("cannot assign to " + target);
			}
			// the value is evaluated before the subscript target
			Object value = eval(valueExpression);
			PySubscript subscript = (PySubscript) target;
			Object container = eval(subscript.getTarget());
			Object key = eval(subscript.getIndex());
			if (container instanceof List) {
				((List<Object>) container).set((int) num(key), value);
			} else {
				((Map<Object, Object>) container).put(key, value);
			}
		}

		@Override
		public Object visit(PyName name) {
			return load(frame, name.getName());
		}

		@Override
		public Object visit(PyNumberLiteral numberLiteral) {
			return numberLiteral.getValue();
		}

		@Override
		public Object visit(PyStringLiteral stringLiteral) {
			return stringLiteral.getValue();
		}

		@Override
		public Object visit(PyList list) {
			List<Object> values = new ArrayList<>();
			for (PyExpression element : list.getElements()) {
				values.add(eval(element));
			}
			return values;
		}

		@Override
		public Object visit(PyTuple tuple) {
			List<Object> values = new ArrayList<>();
			for (PyExpression element : tuple.getElements()) {
				values.add(eval(element));
			}
			return Collections.unmodifiableList(values);
		}

		@Override
		public Object visit(PyDict dict) {
			Map<Object, Object> values = new LinkedHashMap<>();
			for (PyDict.Entry entry : dict.getEntries()) {
				Object key = eval(entry.getKey());
				values.put(key, eval(entry.getValue()));
			}
			return values;
		}

		@Override
		public Object visit(PySubscript subscript) {
			Object container = eval(subscript.getTarget());
			Object key = eval(subscript.getIndex());
			if (container instanceof List) {
				int index = (int) num(key);
				List<?> list = (List<?>) container;
				return list.get(index < 0 ? list.size() + index : index);
			}
			if (container instanceof String) {
				int index = (int) num(key);
				return String.valueOf(((String) container).charAt(index));
			}
			Map<?, ?> map = (Map<?, ?>) container;
			if (!map.containsKey(key)) {
				throw new NoSuchElementException("KeyError: " + key);
			}
			return map.get(key);
		}

		@Override
		public Object visit(PySlice slice) {
			Object target = eval(slice.getTarget());
			int length = target instanceof String ? ((String) target).length() : ((List<?>) target).size();
			int lower = slice.getLower() == null ? 0 : clamp((int) num(eval(slice.getLower())), length);
			int upper = slice.getUpper() == null ? length : clamp((int) num(eval(slice.getUpper())), length);
			upper = Math.max(lower, upper);
			if (target instanceof String) {
				return ((String) target).substring(lower, upper);
			}
			return new ArrayList<>(((List<?>) target).subList(lower, upper));
		}

		private int clamp(int index, int length) {
			if (index < 0) {
				index += length;
			}
			return Math.max(0, Math.min(index, length));
		}

		@Override
		@SuppressWarnings("unchecked")
		public Object visit(PyAttribute attribute) {
			Object target = eval(attribute.getTarget());
			if (target instanceof Map) {
				Map<String, Object> attributes = (Map<String, Object>) target;
				if (attributes.containsKey(attribute.getAttribute())) {
					return attributes.get(attribute.getAttribute());
				}
			}
			if (target instanceof String) {
				String s = (String) target;
				switch (attribute.getAttribute()) {
					case "lower":
						return (PyCallable) args -> s.toLowerCase(Locale.ROOT);
					case "upper":
						return (PyCallable) args -> s.toUpperCase(Locale.ROOT);
					case "strip":
						return (PyCallable) args -> s.trim();
				}
			}
			if (target instanceof List && attribute.getAttribute().equals("append")) {
				return (PyCallable) args -> {
					((List<Object>) target).add(args.get(0));
					return NONE;
				};
			}
			throw new UnsupportedOperationException("no attribute " + attribute.getAttribute() + " on " + target);
		}

		@Override
		public Object visit(PyCall call) {
			Object function = eval(call.getFunction());
			List<Object> args = new ArrayList<>();
			for (PyExpression argument : call.getArguments()) {
				args.add(eval(argument));
			}
			if (!(function instanceof PyCallable)) {
				throw new IllegalStateException("'" + function + "' is not callable");
			}
			return ((PyCallable) function).call(args);
		}

		@Override
		public Object visit(PyBinop binop) {
			Object lhs = eval(binop.getLhs());
			switch (binop.getOperation()) {
				case OR:
					return pyTruthy(lhs) ? lhs : eval(binop.getRhs());
				case AND:
					return pyTruthy(lhs) ? eval(binop.getRhs()) : lhs;
			}
			Object rhs = eval(binop.getRhs());
			switch (binop.getOperation()) {
				case EQ:
					return pyEquals(lhs, rhs);
				case NEQ:
					return !pyEquals(lhs, rhs);
				case LT:
					return compare(lhs, rhs) < 0;
				case LEQ:
					return compare(lhs, rhs) <= 0;
				case GT:
					return compare(lhs, rhs) > 0;
				case GEQ:
					return compare(lhs, rhs) >= 0;
				case IS:
					return lhs == rhs;
				case IS_NOT:
					return lhs != rhs;
				case PLUS:
					if (lhs instanceof String) {
						return lhs + (String) rhs;
					}
					return num(lhs) + num(rhs);
				case MINUS:
					return num(lhs) - num(rhs);
				case TIMES:
					return num(lhs) * num(rhs);
				case DIVIDE:
					return num(lhs) / num(rhs);
				case FLOOR_DIVIDE:
					return Math.floor(num(lhs) / num(rhs));
				case MOD:
					double m = num(lhs) % num(rhs);
					return m != 0 && (m < 0) != (num(rhs) < 0) ? m + num(rhs) : m;
				case POWER:
					return Math.pow(num(lhs), num(rhs));
				default:
					throw new UnsupportedOperationException(binop.getOperation().getSymbol());
			}
		}

		@Override
		public Object visit(PyUnary unary) {
			Object operand = eval(unary.getOperand());
			switch (unary.getOperation()) {
				case NOT:
					return !pyTruthy(operand);
				case NEG:
					return -num(operand);
				case POS:
					return num(operand);
				default:
					throw new UnsupportedOperationException(unary.getOperation().getSymbol());
			}
		}

		@Override
		public Object visit(PyIfExp ifExp) {
			return pyTruthy(eval(ifExp.getTest())) ? eval(ifExp.getBody()) : eval(ifExp.getOrElse());
		}

		@Override
		public Object visit(PyNamedExpr namedExpr) {
			Object value = eval(namedExpr.getValue());
			store(frame, namedExpr.getTarget().getName(), value);
			return value;
		}

		@Override
		public Object visit(PyBuiltins.BuiltinConstant builtinConstant) {
			switch (builtinConstant.getValue()) {
				case "None":
					return NONE;
				case "True":
					return true;
				case "False":
					return false;
				default:
					throw new UnsupportedOperationException(builtinConstant.getValue());
			}
		}
	}
}
