package jspy.model.py.builder;

import jspy.model.py.PyModule;
import jspy.model.py.PyStatement;

import java.util.ArrayList;
import java.util.List;

public class PyModuleBuilder extends PyASTBuilder {

	private final String name;
	private final List<PyStatement> body;

	public PyModuleBuilder(String name) {
		this.name = name;
		this.body = new ArrayList<>();
	}

	public void addAll(List<PyStatement> statements) {
		body.addAll(statements);
	}

	public PyModule getModule() {
		return new PyModule(name, new ArrayList<>(body));
	}

	@Override
	public void addStatement(PyStatement s) {
		body.add(s);
	}
}
