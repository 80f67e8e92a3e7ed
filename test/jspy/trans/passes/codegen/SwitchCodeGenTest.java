package jspy.trans.passes.codegen;

import jspy.trans.issues.AmbiguousFallThroughIssue;
import org.junit.Test;

import static jspy.trans.passes.codegen.CodeGenTestTools.lines;
import static jspy.trans.passes.codegen.CodeGenTestTools.translate;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class SwitchCodeGenTest {

	@Test
	public void testAliasCasesAndDefault() {
		String source = lines(
				"var x, y;",
				"switch (x) {",
				"  case 1:",
				"    y = 'one';",
				"    break;",
				"  case 2:",
				"  case 3:",
				"    y = 'few';",
				"    break;",
				"  default:",
				"    y = 'many';",
				"}");
		assertThat(translate(source), is(lines(
				"from js_compat import JSUndefined, js_strict_eq",
				"",
				"x = JSUndefined",
				"y = JSUndefined",
				"__js_switch_disc_1 = x",
				"while True:",
				"    if js_strict_eq(__js_switch_disc_1, 1):",
				"        y = \"one\"",
				"        break",
				"    elif js_strict_eq(__js_switch_disc_1, 2) or js_strict_eq(__js_switch_disc_1, 3):",
				"        y = \"few\"",
				"        break",
				"    else:",
				"        y = \"many\"",
				"        break",
				"    break")));
	}

	// a default clause in the middle still becomes the final else branch
	@Test
	public void testDefaultInTheMiddle() {
		String source = lines(
				"var x, y;",
				"switch (x) {",
				"  default:",
				"    y = 0;",
				"    break;",
				"  case 1:",
				"    y = 1;",
				"}");
		assertThat(translate(source), is(lines(
				"from js_compat import JSUndefined, js_strict_eq",
				"",
				"x = JSUndefined",
				"y = JSUndefined",
				"__js_switch_disc_1 = x",
				"while True:",
				"    if js_strict_eq(__js_switch_disc_1, 1):",
				"        y = 1",
				"        break",
				"    else:",
				"        y = 0",
				"        break",
				"    break")));
	}

	@Test
	public void testTrailingEmptyCase() {
		String source = lines(
				"var x, y;",
				"switch (x) { case 1: y = 1; break; case 2: }");
		assertThat(translate(source), is(lines(
				"from js_compat import JSUndefined, js_strict_eq",
				"",
				"x = JSUndefined",
				"y = JSUndefined",
				"__js_switch_disc_1 = x",
				"while True:",
				"    if js_strict_eq(__js_switch_disc_1, 1):",
				"        y = 1",
				"        break",
				"    elif js_strict_eq(__js_switch_disc_1, 2):",
				"        break",
				"    break")));
	}

	// return inside a block terminates a case as well as break does
	@Test
	public void testReturnTerminatesCase() {
		String source = lines(
				"function f(x) {",
				"  switch (x) {",
				"    case 1: { return 1; }",
				"    case 2: return 2;",
				"  }",
				"  return 0;",
				"}");
		assertThat(translate(source), is(lines(
				"from js_compat import js_strict_eq",
				"",
				"def f(x):",
				"    __js_switch_disc_1 = x",
				"    while True:",
				"        if js_strict_eq(__js_switch_disc_1, 1):",
				"            return 1",
				"        elif js_strict_eq(__js_switch_disc_1, 2):",
				"            return 2",
				"        break",
				"    return 0")));
	}

	// break inside the switch leaves the dispatch loop only; the counted loop still runs its update
	@Test
	public void testSwitchInsideLoop() {
		String source = lines(
				"var i;",
				"for (i = 0; i < 2; i++) {",
				"  switch (i) {",
				"    case 0: break;",
				"  }",
				"}");
		assertThat(translate(source), is(lines(
				"from js_compat import JSUndefined, js_add, js_strict_eq, js_to_number, js_truthy",
				"",
				"i = JSUndefined",
				"i = 0",
				"while js_truthy(i < 2):",
				"    __js_switch_disc_1 = i",
				"    while True:",
				"        if js_strict_eq(__js_switch_disc_1, 0):",
				"            break",
				"        break",
				"    i = js_add(js_to_number(i), 1)")));
	}

	@Test
	public void testDiscriminantSharesTempCounter() {
		String source = lines(
				"var a, b;",
				"switch (a || b) { case 1: b = a && b; }");
		assertThat(translate(source), is(lines(
				"from js_compat import JSUndefined, js_strict_eq, js_truthy",
				"",
				"a = JSUndefined",
				"b = JSUndefined",
				"__js_switch_disc_1 = __js_tmp2 if js_truthy(__js_tmp2 := a) else b",
				"while True:",
				"    if js_strict_eq(__js_switch_disc_1, 1):",
				"        b = b if js_truthy(__js_tmp3 := a) else __js_tmp3",
				"        break",
				"    break")));
	}

	@Test(expected = AmbiguousFallThroughIssue.class)
	public void testFallThroughRejected() {
		translate(lines(
				"var x, y;",
				"switch (x) { case 1: y = 1; case 2: y = 2; break; }"));
	}

	// alias cases between two bodies do not make the fall-through safe
	@Test(expected = AmbiguousFallThroughIssue.class)
	public void testFallThroughAcrossAliasesRejected() {
		translate(lines(
				"var x, y;",
				"switch (x) { case 1: y = 1; case 2: case 3: y = 3; }"));
	}

	@Test(expected = AmbiguousFallThroughIssue.class)
	public void testFallThroughIntoDefaultRejected() {
		translate(lines(
				"var x, y;",
				"switch (x) { case 1: y = 1; default: y = 2; }"));
	}
}
