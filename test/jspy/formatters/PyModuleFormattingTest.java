package jspy.formatters;

import jspy.model.py.*;
import jspy.model.py.builder.PyBlockBuilder;
import jspy.model.py.builder.PyIfBuilder;
import jspy.model.py.builder.PyModuleBuilder;
import jspy.trans.JSPyTranslator;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class PyModuleFormattingTest {

	private static PyCall call(String function, PyExpression... args) {
		return new PyCall(new PyName(function), Arrays.asList(args));
	}

	@Test
	public void testImportsAreFollowedByABlankLine() {
		PyModuleBuilder module = new PyModuleBuilder("m");
		module.addStatement(new PyImport("math", "_js_math"));
		module.addStatement(new PyImportFrom("js_compat", Arrays.asList("JSUndefined", "js_truthy")));
		module.addStatement(new PyAssignment(new PyName("x"), new PyName("JSUndefined")));
		assertThat(JSPyTranslator.format(module.getModule()), is(
				"import math as _js_math\n" +
				"from js_compat import JSUndefined, js_truthy\n" +
				"\n" +
				"x = JSUndefined\n"));
	}

	@Test
	public void testNestedBlocks() {
		PyModuleBuilder module = new PyModuleBuilder("m");
		try (PyBlockBuilder body = new PyBlockBuilder(module::addAll)) {
			try (PyBlockBuilder fn = body.defineFunction("f", Arrays.asList("a", "b"))) {
				fn.globalStmt(Collections.singletonList("total"), false);
				try (PyBlockBuilder loop = fn.whileLoop(call("js_truthy", new PyName("a")))) {
					try (PyIfBuilder check = loop.ifStmt(new PyName("b"))) {
						try (PyBlockBuilder yes = check.whenTrue()) {
							yes.continueStmt();
						}
						try (PyBlockBuilder no = check.whenFalse()) {
							no.breakStmt();
						}
					}
				}
				try (PyBlockBuilder each = fn.forLoop(new PyName("k"), call("js_for_in_keys", new PyName("a")))) {
					each.addStatement(call("console_log", new PyName("k")));
				}
				fn.returnStmt(null);
			}
			try (PyBlockBuilder inner = body.defineFunction("g", Collections.emptyList())) {
				inner.globalStmt(Arrays.asList("x", "y"), true);
			}
		}
		assertThat(JSPyTranslator.format(module.getModule()), is(
				"def f(a, b):\n" +
				"    global total\n" +
				"    while js_truthy(a):\n" +
				"        if b:\n" +
				"            continue\n" +
				"        else:\n" +
				"            break\n" +
				"    for k in js_for_in_keys(a):\n" +
				"        console_log(k)\n" +
				"    return\n" +
				"def g():\n" +
				"    nonlocal x, y\n"));
	}

	@Test
	public void testElifChainAndPass() {
		PyModuleBuilder module = new PyModuleBuilder("m");
		PyIf innermost = new PyIf(new PyName("c"), Collections.emptyList(),
				Collections.singletonList(new PyExpressionStatement(call("f"))));
		PyIf middle = new PyIf(new PyName("b"), Collections.singletonList(new PyBreak()),
				Collections.singletonList(innermost));
		module.addStatement(new PyIf(new PyName("a"), Collections.singletonList(new PyContinue()),
				Collections.singletonList(middle)));
		module.addStatement(new PyWhile(PyBuiltins.True, Collections.emptyList()));
		assertThat(JSPyTranslator.format(module.getModule()), is(
				"if a:\n" +
				"    continue\n" +
				"elif b:\n" +
				"    break\n" +
				"elif c:\n" +
				"    pass\n" +
				"else:\n" +
				"    f()\n" +
				"while True:\n" +
				"    pass\n"));
	}

	// an else branch holding an if next to other statements is not an elif
	@Test
	public void testElseWithMoreThanAnIf() {
		PyModuleBuilder module = new PyModuleBuilder("m");
		PyIf nested = new PyIf(new PyName("b"), Collections.singletonList(new PyBreak()), Collections.emptyList());
		module.addStatement(new PyIf(new PyName("a"), Collections.singletonList(new PyBreak()),
				Arrays.asList(nested, new PyExpressionStatement(call("f")))));
		assertThat(JSPyTranslator.format(module.getModule()), is(
				"if a:\n" +
				"    break\n" +
				"else:\n" +
				"    if b:\n" +
				"        break\n" +
				"    f()\n"));
	}
}
