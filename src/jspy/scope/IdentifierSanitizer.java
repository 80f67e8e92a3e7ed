package jspy.scope;

import jspy.model.py.PyRuntime;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The pure renaming function applied to every JavaScript identifier that reaches the output.
 *
 * A name is suffixed with {@value #SUFFIX} when it would clash with Python syntax, with a name generated code
 * relies on, or with the reserved {@code __js_}/{@code _js_} prefixes. Names already ending in the suffix are
 * suffixed again, which keeps the mapping injective.
 */
public final class IdentifierSanitizer {

	private IdentifierSanitizer() {}

	public static final String SUFFIX = "_js";

	public static final String TEMP_PREFIX = "__js_";
	public static final String ALIAS_PREFIX = "_js_";

	private static final String DOLLAR = "_dollar_";

	public static final Set<String> PYTHON_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del", "elif", "else",
			"except", "finally", "for", "from", "global", "if", "import", "in", "is", "lambda", "nonlocal", "not",
			"or", "pass", "raise", "return", "try", "while", "with", "yield")));

	public static final Set<String> PYTHON_LITERALS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"None", "True", "False")));

	// builtins referenced by generated code
	public static final Set<String> PYTHON_BUILTINS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"len", "abs", "max", "min", "float")));

	public static boolean needsRename(String name) {
		return PYTHON_KEYWORDS.contains(name) ||
				PYTHON_LITERALS.contains(name) ||
				PYTHON_BUILTINS.contains(name) ||
				PyRuntime.ALL.contains(name) ||
				name.startsWith(TEMP_PREFIX) ||
				name.startsWith(ALIAS_PREFIX) ||
				name.endsWith(SUFFIX) ||
				name.indexOf('$') >= 0;
	}

	public static String sanitize(String name) {
		if (needsRename(name)) {
			// '$' is legal in JavaScript identifiers only
			return name.replace("$", DOLLAR) + SUFFIX;
		}
		return name;
	}
}
