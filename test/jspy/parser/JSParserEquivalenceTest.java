package jspy.parser;

import jspy.model.js.*;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static jspy.model.js.JSBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

@RunWith(Parameterized.class)
public class JSParserEquivalenceTest {

	@Parameters(name = "{0}")
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"x = 1;", program(exprStmt(assign(id("x"), num(1))))},
				{"(x);", program(exprStmt(id("x")))},
				{"var a = 'b';", program(var("a", str("b")))},
				{"var a;", program(var("a", null))},
				{"f(1, 2.5);", program(exprStmt(call(id("f"), num(1), num(2.5))))},
				{"while (true) { break; }", program(whileLoop(bool(true), block(breakStmt())))},
				{"for (;;) {}", program(forLoop(null, null, null, block()))},
				{"if (a) b(); else c();",
						program(ifStmt(id("a"), exprStmt(call(id("b"))), exprStmt(call(id("c")))))},
				{"if (a) {}", program(ifStmt(id("a"), block(), null))},
				{"function g(a, b) { return a; }",
						program(function("g", Arrays.asList("a", "b"), returnStmt(id("a"))))},
				{"function h() { return; }", program(function("h", Collections.emptyList(), returnStmt(null)))},
				{"switch (x) { case 1: y(); default: }",
						program(switchStmt(id("x"), caseOf(num(1), exprStmt(call(id("y")))), defaultCase()))},
				{"l: while (false) continue l;",
						program(labeled("l", whileLoop(bool(false), continueStmt("l"))))},
		});
	}

	private final String source;
	private final JSProgram expected;

	public JSParserEquivalenceTest(String source, JSProgram expected) {
		this.source = source;
		this.expected = expected;
	}

	private static JSProgram parse(String source) throws ParsingError {
		return JSParser.parse(Paths.get("test.js"), source);
	}

	@Test
	public void test() throws ParsingError {
		assertThat(parse(source), is(expected));
	}
}
