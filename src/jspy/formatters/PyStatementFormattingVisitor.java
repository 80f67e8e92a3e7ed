package jspy.formatters;

import jspy.model.py.*;

import java.io.IOException;
import java.util.List;

public class PyStatementFormattingVisitor extends PyStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public PyStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeExpression(PyExpression expression) throws IOException {
		expression.accept(new PyExpressionFormattingVisitor(out));
	}

	// writes ":" and the indented suite; an empty suite becomes "pass"
	private void writeBlock(List<PyStatement> block) throws IOException {
		out.write(":");
		try (IndentingWriter.Indent ignored = out.indent()) {
			if (block.isEmpty()) {
				out.newLine();
				out.write("pass");
			}
			for (PyStatement statement : block) {
				out.newLine();
				statement.accept(this);
			}
		}
	}

	@Override
	public Void visit(PyAssignment assignment) throws IOException {
		writeExpression(assignment.getTarget());
		out.write(" = ");
		writeExpression(assignment.getValue());
		return null;
	}

	@Override
	public Void visit(PyExpressionStatement expressionStatement) throws IOException {
		writeExpression(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(PyIf pyIf) throws IOException {
		out.write("if ");
		writeIfChain(pyIf);
		return null;
	}

	private void writeIfChain(PyIf pyIf) throws IOException {
		writeExpression(pyIf.getCondition());
		writeBlock(pyIf.getBody());
		List<PyStatement> orElse = pyIf.getOrElse();
		if (orElse.size() == 1 && orElse.get(0) instanceof PyIf) {
			out.newLine();
			out.write("elif ");
			writeIfChain((PyIf) orElse.get(0));
		} else if (!orElse.isEmpty()) {
			out.newLine();
			out.write("else");
			writeBlock(orElse);
		}
	}

	@Override
	public Void visit(PyWhile pyWhile) throws IOException {
		out.write("while ");
		writeExpression(pyWhile.getCondition());
		writeBlock(pyWhile.getBody());
		return null;
	}

	@Override
	public Void visit(PyFor pyFor) throws IOException {
		out.write("for ");
		writeExpression(pyFor.getTarget());
		out.write(" in ");
		writeExpression(pyFor.getIterable());
		writeBlock(pyFor.getBody());
		return null;
	}

	@Override
	public Void visit(PyBreak pyBreak) throws IOException {
		out.write("break");
		return null;
	}

	@Override
	public Void visit(PyContinue pyContinue) throws IOException {
		out.write("continue");
		return null;
	}

	@Override
	public Void visit(PyReturn pyReturn) throws IOException {
		out.write("return");
		if (pyReturn.getValue() != null) {
			out.write(" ");
			writeExpression(pyReturn.getValue());
		}
		return null;
	}

	@Override
	public Void visit(PyFunctionDef functionDef) throws IOException {
		out.write("def ");
		out.write(functionDef.getName());
		out.write("(");
		FormattingTools.writeCommaSeparated(out, functionDef.getParams(), out::write);
		out.write(")");
		writeBlock(functionDef.getBody());
		return null;
	}

	@Override
	public Void visit(PyGlobal global) throws IOException {
		out.write(global.isNonlocal() ? "nonlocal " : "global ");
		FormattingTools.writeCommaSeparated(out, global.getNames(), out::write);
		return null;
	}

	@Override
	public Void visit(PyImport pyImport) throws IOException {
		out.write("import ");
		out.write(pyImport.getModule());
		if (pyImport.getAlias() != null) {
			out.write(" as ");
			out.write(pyImport.getAlias());
		}
		return null;
	}

	@Override
	public Void visit(PyImportFrom importFrom) throws IOException {
		out.write("from ");
		out.write(importFrom.getModule());
		out.write(" import ");
		FormattingTools.writeCommaSeparated(out, importFrom.getNames(), out::write);
		return null;
	}
}
