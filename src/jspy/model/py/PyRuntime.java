package jspy.model.py;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Names exported by the Python runtime library that generated code imports, and the standard library modules it
 * imports under reserved aliases.
 */
public final class PyRuntime {

	private PyRuntime() {}

	public static final String JS_UNDEFINED = "JSUndefined";
	public static final String JS_TRUTHY = "js_truthy";
	public static final String JS_STRICT_EQ = "js_strict_eq";
	public static final String JS_STRICT_NEQ = "js_strict_neq";
	public static final String JS_LOOSE_EQ = "js_loose_eq";
	public static final String JS_LOOSE_NEQ = "js_loose_neq";
	public static final String JS_TO_NUMBER = "js_to_number";
	public static final String JS_ADD = "js_add";
	public static final String JS_SUB = "js_sub";
	public static final String JS_MUL = "js_mul";
	public static final String JS_DIV = "js_div";
	public static final String JS_MOD = "js_mod";
	public static final String JS_FOR_IN_KEYS = "js_for_in_keys";
	public static final String JS_DELETE = "js_delete";
	public static final String JS_TYPEOF = "js_typeof";
	public static final String COMPILE_JS_REGEX = "compile_js_regex";
	public static final String JS_ROUND = "js_round";
	public static final String JS_CHAR_CODE_AT = "js_char_code_at";
	public static final String JS_SUBSTRING = "js_substring";
	public static final String JS_ARRAY_POP = "js_array_pop";
	public static final String JS_DATE_NOW = "js_date_now";
	public static final String CONSOLE_LOG = "console_log";

	public static final Set<String> ALL = Collections.unmodifiableSet(new TreeSet<>(Arrays.asList(
			JS_UNDEFINED, JS_TRUTHY, JS_STRICT_EQ, JS_STRICT_NEQ, JS_LOOSE_EQ, JS_LOOSE_NEQ, JS_TO_NUMBER,
			JS_ADD, JS_SUB, JS_MUL, JS_DIV, JS_MOD, JS_FOR_IN_KEYS, JS_DELETE, JS_TYPEOF, COMPILE_JS_REGEX,
			JS_ROUND, JS_CHAR_CODE_AT, JS_SUBSTRING, JS_ARRAY_POP, JS_DATE_NOW, CONSOLE_LOG)));

	public static final String DEFAULT_MODULE = "js_compat";

	public enum StdlibModule {
		MATH("math", "_js_math"),
		RANDOM("random", "_js_random"),
		RE("re", "_js_re"),
		TIME("time", "_js_time");

		private final String moduleName;
		private final String alias;

		StdlibModule(String moduleName, String alias) {
			this.moduleName = moduleName;
			this.alias = alias;
		}

		public String getModuleName() {
			return moduleName;
		}

		public String getAlias() {
			return alias;
		}
	}
}
