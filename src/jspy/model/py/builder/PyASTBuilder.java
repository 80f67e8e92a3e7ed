package jspy.model.py.builder;

import jspy.model.py.PyStatement;

public abstract class PyASTBuilder {

	public abstract void addStatement(PyStatement s);

}
