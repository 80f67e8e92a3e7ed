package jspy.formatters;

import jspy.model.py.*;

import java.io.IOException;

public class PyNodeFormattingVisitor extends PyNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PyNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private static boolean isImport(PyStatement statement) {
		return statement instanceof PyImport || statement instanceof PyImportFrom;
	}

	@Override
	public Void visit(PyModule module) throws IOException {
		PyStatementFormattingVisitor statementFormatter = new PyStatementFormattingVisitor(out);
		PyStatement previous = null;
		for (PyStatement statement : module.getBody()) {
			if (previous != null && isImport(previous) && !isImport(statement)) {
				out.newLine();
			}
			statement.accept(statementFormatter);
			out.newLine();
			previous = statement;
		}
		return null;
	}

	@Override
	public Void visit(PyStatement statement) throws IOException {
		statement.accept(new PyStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(PyExpression expression) throws IOException {
		expression.accept(new PyExpressionFormattingVisitor(out));
		return null;
	}
}
