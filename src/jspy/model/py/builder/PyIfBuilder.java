package jspy.model.py.builder;

import jspy.model.py.PyExpression;
import jspy.model.py.PyIf;
import jspy.model.py.PyStatement;

import java.io.Closeable;
import java.util.Collections;
import java.util.List;

public class PyIfBuilder implements Closeable {

	private final PyASTBuilder builder;
	private final PyExpression condition;
	private List<PyStatement> trueBranch;
	private List<PyStatement> falseBranch;

	public PyIfBuilder(PyASTBuilder builder, PyExpression condition) {
		this.builder = builder;
		this.condition = condition;
		this.trueBranch = Collections.emptyList();
		this.falseBranch = Collections.emptyList();
	}

	private void addTrue(List<PyStatement> block) {
		trueBranch = block;
	}

	private void addFalse(List<PyStatement> block) {
		falseBranch = block;
	}

	public PyBlockBuilder whenTrue() {
		return new PyBlockBuilder(this::addTrue);
	}

	public PyBlockBuilder whenFalse() {
		return new PyBlockBuilder(this::addFalse);
	}

	@Override
	public void close() {
		builder.addStatement(new PyIf(condition, trueBranch, falseBranch));
	}

}
