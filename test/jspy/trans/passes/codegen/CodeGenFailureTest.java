package jspy.trans.passes.codegen;

import jspy.errors.Issue;
import jspy.trans.issues.*;
import jspy.trans.passes.parse.ParsingIssue;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.util.Arrays;
import java.util.List;

import static jspy.trans.passes.codegen.CodeGenTestTools.translate;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

@RunWith(Parameterized.class)
public class CodeGenFailureTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				// outside the supported subset
				{"let x = 1;", UnsupportedConstructIssue.class},
				{"var o = new Object();", UnsupportedConstructIssue.class},
				{"function f() { return this; }", UnsupportedConstructIssue.class},
				{"var f = function() {};", UnsupportedConstructIssue.class},
				{"var o = {get a() { return 1; }};", UnsupportedConstructIssue.class},
				{"var a, b; a = a & b;", UnsupportedConstructIssue.class},
				{"var a, b; a = a << 1;", UnsupportedConstructIssue.class},
				{"var a, b; a = 'k' in b;", UnsupportedConstructIssue.class},
				{"var a, b; a = a instanceof b;", UnsupportedConstructIssue.class},
				{"var x; x = void 0;", UnsupportedConstructIssue.class},
				{"var x; delete x;", UnsupportedConstructIssue.class},
				{"throw 1;", UnsupportedConstructIssue.class},
				{"var o; with (o) { }", UnsupportedConstructIssue.class},
				{"try { } catch (e) { }", UnsupportedConstructIssue.class},
				{"outer: while (true) { break outer; }", UnsupportedConstructIssue.class},
				{"var s; s = s.replace(/a/, 'b');", UnsupportedConstructIssue.class},
				{"var s; s = s.charAt(1, 2);", UnsupportedConstructIssue.class},
				{"var m; m = Math;", UnsupportedConstructIssue.class},
				{"var m; m = Math.LN2;", UnsupportedConstructIssue.class},
				{"var m; m = Math.hypot(1, 2);", UnsupportedConstructIssue.class},
				{"Math.PI = 3;", UnsupportedConstructIssue.class},
				{"var a; a.length = 0;", UnsupportedConstructIssue.class},
				{"var a; a.push(1, 2);", UnsupportedConstructIssue.class},

				// value contexts that cannot be expressed as one Python expression
				{"var a; a.push(1);", AmbiguousEvaluationContextIssue.class},
				{"var o, y; y = (o.p = 1);", AmbiguousEvaluationContextIssue.class},
				{"var o, y; y = o.p++;", AmbiguousEvaluationContextIssue.class},
				{"var a, b, c; c = (a, b);", AmbiguousEvaluationContextIssue.class},
				{"var a, b; if (a = 1, b) {}", AmbiguousEvaluationContextIssue.class},

				// bindings
				{"x = 1;", UnresolvedBindingIssue.class},
				{"var y = x;", UnresolvedBindingIssue.class},
				{"function f() { return missing; }", UnresolvedBindingIssue.class},
				{"function f() { counter++; }", UnresolvedBindingIssue.class},

				// control flow
				{"var x; switch (x) { case 1: x = 1; case 2: x = 2; }", AmbiguousFallThroughIssue.class},
				{"var x; while (x) { switch (x) { case 1: continue; } }", ContinueInsideDispatchIssue.class},

				// syntax
				{"var = ;", ParsingIssue.class},
				{"break;", ParsingIssue.class},
		});
	}

	private final String source;
	private final Class<? extends Issue> expected;

	public CodeGenFailureTest(String source, Class<? extends Issue> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() {
		try {
			translate(source);
			fail("expected " + expected.getSimpleName());
		} catch (Issue issue) {
			assertThat(issue, instanceOf(expected));
		}
	}
}
