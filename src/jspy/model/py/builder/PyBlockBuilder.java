package jspy.model.py.builder;

import jspy.model.py.*;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class PyBlockBuilder extends PyASTBuilder implements Closeable {

	private final List<PyStatement> statements;

	public interface OnSuccess {
		void action(List<PyStatement> block);
	}

	private final OnSuccess onSuccess;

	public PyBlockBuilder(OnSuccess onSuccess) {
		this.statements = new ArrayList<>();
		this.onSuccess = onSuccess;
	}

	/**
	 * @return a builder whose statements are only read back through {@link #getStatements()}
	 */
	public static PyBlockBuilder detached() {
		return new PyBlockBuilder(block -> {});
	}

	public List<PyStatement> getStatements() {
		return Collections.unmodifiableList(statements);
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	public void assign(PyExpression target, PyExpression value) {
		addStatement(new PyAssignment(target, value));
	}

	public PyIfBuilder ifStmt(PyExpression condition) {
		return new PyIfBuilder(this, condition);
	}

	public PyBlockBuilder whileLoop(PyExpression condition) {
		return new PyBlockBuilder(block -> addStatement(new PyWhile(condition, block)));
	}

	public PyBlockBuilder forLoop(PyExpression target, PyExpression iterable) {
		return new PyBlockBuilder(block -> addStatement(new PyFor(target, iterable, block)));
	}

	public PyBlockBuilder defineFunction(String name, List<String> params) {
		return new PyBlockBuilder(block -> addStatement(new PyFunctionDef(name, params, block)));
	}

	public void globalStmt(List<String> names, boolean nonlocal) {
		addStatement(new PyGlobal(names, nonlocal));
	}

	public void breakStmt() {
		addStatement(new PyBreak());
	}

	public void continueStmt() {
		addStatement(new PyContinue());
	}

	public void returnStmt(PyExpression value) {
		addStatement(new PyReturn(value));
	}

	public void addStatement(PyExpression expression) {
		addStatement(new PyExpressionStatement(expression));
	}

	public void addAll(List<PyStatement> block) {
		statements.addAll(block);
	}

	@Override
	public void addStatement(PyStatement s) {
		statements.add(s);
	}

	@Override
	public void close() {
		onSuccess.action(new ArrayList<>(statements));
	}
}
