package jspy.trans.passes.structure;

import jspy.model.js.*;
import jspy.parser.JSParser;
import jspy.parser.ParsingError;
import jspy.trans.issues.ContinueInsideDispatchIssue;
import jspy.trans.issues.JumpOutsideTargetIssue;
import jspy.trans.issues.UnsupportedConstructIssue;
import org.junit.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static jspy.model.js.JSBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class StructuralAnalysisPassTest {

	private static JSProgram parse(String source) throws ParsingError {
		return JSParser.parse(Paths.get("test.js"), source);
	}

	private static JSStatement blockStatement(JSStatement statement, int index) {
		return ((JSBlockStatement) statement).getBody().get(index);
	}

	@Test
	public void testNestedLoopIds() throws ParsingError {
		JSProgram program = parse(
				"var i, j;\n" +
				"for (i = 0; i < 3; i++) {\n" +
				"  while (j) { continue; }\n" +
				"  continue;\n" +
				"}\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSForStatement outer = (JSForStatement) program.getBody().get(1);
		JSWhileStatement inner = (JSWhileStatement) blockStatement(outer.getBody(), 0);
		JSStatement innerContinue = blockStatement(inner.getBody(), 0);
		JSStatement outerContinue = blockStatement(outer.getBody(), 1);

		assertThat(annotations.getLoopId(outer), is(1));
		assertThat(annotations.getLoopId(inner), is(2));
		assertThat(annotations.getEnclosingLoopId(innerContinue), is(2));
		assertThat(annotations.getEnclosingLoopId(outerContinue), is(1));
		assertThat(annotations.getEnclosingLoopId(outer), is(nullValue()));
		// the loop statement itself belongs to the enclosing loop
		assertThat(annotations.getEnclosingLoopId(inner), is(1));
	}

	// ids keep increasing across functions, so no two loops share one
	@Test
	public void testLoopIdsUniqueAcrossFunctions() throws ParsingError {
		JSProgram program = parse(
				"function f() { while (1) {} }\n" +
				"function g() { while (1) {} }\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSFunctionDeclaration f = (JSFunctionDeclaration) program.getBody().get(0);
		JSFunctionDeclaration g = (JSFunctionDeclaration) program.getBody().get(1);
		assertThat(annotations.getLoopId(f.getBody().get(0)), is(1));
		assertThat(annotations.getLoopId(g.getBody().get(0)), is(2));
	}

	@Test
	public void testDispatchFlag() throws ParsingError {
		JSProgram program = parse(
				"var x, y;\n" +
				"switch (x) { case 1: y = 1; break; }\n" +
				"y = 2;\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSSwitchStatement switchStatement = (JSSwitchStatement) program.getBody().get(1);
		JSSwitchCase first = switchStatement.getCases().get(0);
		assertTrue(annotations.isInsideDispatch(first.getConsequent().get(0)));
		assertTrue(annotations.isInsideDispatch(first.getConsequent().get(1)));
		assertFalse(annotations.isInsideDispatch(program.getBody().get(2)));
	}

	@Test
	public void testBreakInsideSwitchInsideLoop() throws ParsingError {
		JSProgram program = parse(
				"var x;\n" +
				"while (x) { switch (x) { case 1: break; } }\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSWhileStatement loop = (JSWhileStatement) program.getBody().get(1);
		JSSwitchStatement switchStatement = (JSSwitchStatement) blockStatement(loop.getBody(), 0);
		JSStatement breakStatement = switchStatement.getCases().get(0).getConsequent().get(0);
		assertTrue(annotations.isInsideDispatch(breakStatement));
		assertThat(annotations.getEnclosingLoopId(breakStatement), is(1));
	}

	@Test(expected = ContinueInsideDispatchIssue.class)
	public void testContinueInsideSwitch() throws ParsingError {
		StructuralAnalysisPass.perform(parse(
				"var x;\n" +
				"while (x) { switch (x) { case 1: continue; } }\n"));
	}

	@Test
	public void testContinueInsideLoopInsideSwitch() throws ParsingError {
		JSProgram program = parse(
				"var x;\n" +
				"switch (x) { case 1: while (x) { continue; } break; }\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSSwitchStatement switchStatement = (JSSwitchStatement) program.getBody().get(1);
		JSWhileStatement loop = (JSWhileStatement) switchStatement.getCases().get(0).getConsequent().get(0);
		JSStatement continueStatement = blockStatement(loop.getBody(), 0);
		assertFalse(annotations.isInsideDispatch(continueStatement));
		assertThat(annotations.getEnclosingLoopId(continueStatement), is(annotations.getLoopId(loop)));
	}

	@Test(expected = JumpOutsideTargetIssue.class)
	public void testBreakOutsideTarget() {
		StructuralAnalysisPass.perform(program(breakStmt()));
	}

	@Test(expected = JumpOutsideTargetIssue.class)
	public void testContinueOutsideLoop() {
		StructuralAnalysisPass.perform(program(switchStmt(id("x"), caseOf(num(1), continueStmt()))));
	}

	// jump targets never cross a function boundary
	@Test(expected = JumpOutsideTargetIssue.class)
	public void testBreakDoesNotCrossFunction() {
		StructuralAnalysisPass.perform(program(
				whileLoop(bool(true), block(function("f", Collections.emptyList(), breakStmt())))));
	}

	@Test(expected = UnsupportedConstructIssue.class)
	public void testLabelledBreak() {
		StructuralAnalysisPass.perform(program(
				labeled("outer", whileLoop(bool(true), block(breakStmt("outer"))))));
	}

	@Test(expected = UnsupportedConstructIssue.class)
	public void testLabelledContinue() {
		StructuralAnalysisPass.perform(program(
				labeled("outer", whileLoop(bool(true), block(continueStmt("outer"))))));
	}

	@Test
	public void testHoistedNames() throws ParsingError {
		JSProgram program = parse(
				"var a = 1;\n" +
				"function f(p) {\n" +
				"  var b, p;\n" +
				"  if (a) { var c = 2; }\n" +
				"  for (var i = 0; i < 2; i++) { var b; }\n" +
				"  for (var k in a) {}\n" +
				"  function g() { var hidden; }\n" +
				"}\n" +
				"var d;\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSFunctionDeclaration f = (JSFunctionDeclaration) program.getBody().get(1);

		assertThat(new ArrayList<>(annotations.getHoistedNames(program)), is(Arrays.asList("a", "d")));
		assertThat(annotations.getFunctionNames(program), is(Collections.singleton("f")));
		// first-declaration order, without parameters and without nested function bodies
		assertThat(new ArrayList<>(annotations.getHoistedNames(f)), is(Arrays.asList("b", "c", "i", "k")));
		assertThat(annotations.getFunctionNames(f), is(Collections.singleton("g")));
	}

	@Test
	public void testFreeAssignedNames() throws ParsingError {
		JSProgram program = parse(
				"var total = 0;\n" +
				"function add(n) {\n" +
				"  var local;\n" +
				"  local = n;\n" +
				"  n = n + 1;\n" +
				"  total += local;\n" +
				"  counter++;\n" +
				"}\n");
		StructuralAnnotations annotations = StructuralAnalysisPass.perform(program);
		JSFunctionDeclaration add = (JSFunctionDeclaration) program.getBody().get(1);
		assertThat(new ArrayList<>(annotations.getFreeAssignedNames(add)),
				is(Arrays.asList("total", "counter")));
	}

	// the pass only reads the tree
	@Test
	public void testTreeUnchanged() throws ParsingError {
		String source = "var x; for (x = 0; x < 2; x++) { if (x) continue; }";
		JSProgram program = parse(source);
		StructuralAnalysisPass.perform(program);
		assertThat(program, is(parse(source)));
	}
}
