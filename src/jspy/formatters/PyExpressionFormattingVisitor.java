package jspy.formatters;

import jspy.InternalCompilerError;
import jspy.model.py.*;

import java.io.IOException;

/**
 * Writes Python expressions, adding parentheses only where the surrounding context binds tighter than the
 * expression itself. The context precedence is the lowest precedence that may appear unparenthesized at the
 * current position.
 */
public class PyExpressionFormattingVisitor extends PyExpressionVisitor<Void, IOException> {

	// precedence levels, lowest first
	public static final int NAMED_EXPR = 1;
	public static final int IF_EXP = 2;
	public static final int ATOM = 11;

	/**
	 * Context for a call argument, where a bare named expression is legal.
	 */
	public static final int ARGUMENT_CONTEXT = NAMED_EXPR;

	/**
	 * Context for statement-level expressions and display elements.
	 */
	public static final int STATEMENT_CONTEXT = IF_EXP;

	private final IndentingWriter out;
	private final int context;

	public PyExpressionFormattingVisitor(IndentingWriter out) {
		this(out, STATEMENT_CONTEXT);
	}

	public PyExpressionFormattingVisitor(IndentingWriter out, int context) {
		this.out = out;
		this.context = context;
	}

	private void write(PyExpression expression, int context) throws IOException {
		expression.accept(new PyExpressionFormattingVisitor(out, context));
	}

	private boolean open(int precedence) throws IOException {
		if (precedence < context) {
			out.write("(");
			return true;
		}
		return false;
	}

	private void close(boolean opened) throws IOException {
		if (opened) {
			out.write(")");
		}
	}

	@Override
	public Void visit(PyName name) throws IOException {
		out.write(name.getName());
		return null;
	}

	@Override
	public Void visit(PyNumberLiteral numberLiteral) throws IOException {
		double value = numberLiteral.getValue();
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			throw new InternalCompilerError("non-finite number literal " + value);
		}
		boolean opened = value < 0 && open(PyUnary.Operation.NEG.getPrecedence());
		if (value == Math.rint(value) && Math.abs(value) < 1e16) {
			if (value == 0 && 1 / value < 0) {
				out.write("-0.0");
			} else {
				out.write(Long.toString((long) value));
			}
		} else {
			out.write(Double.toString(value));
		}
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyStringLiteral stringLiteral) throws IOException {
		out.write("\"");
		out.write(FormattingTools.escapePythonString(stringLiteral.getValue()));
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(PyBuiltins.BuiltinConstant builtinConstant) throws IOException {
		out.write(builtinConstant.getValue());
		return null;
	}

	@Override
	public Void visit(PyList list) throws IOException {
		out.write("[");
		FormattingTools.writeCommaSeparated(out, list.getElements(), e -> write(e, STATEMENT_CONTEXT));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(PyTuple tuple) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, tuple.getElements(), e -> write(e, STATEMENT_CONTEXT));
		if (tuple.getElements().size() == 1) {
			out.write(",");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(PyDict dict) throws IOException {
		out.write("{");
		FormattingTools.writeCommaSeparated(out, dict.getEntries(), entry -> {
			write(entry.getKey(), STATEMENT_CONTEXT);
			out.write(": ");
			write(entry.getValue(), STATEMENT_CONTEXT);
		});
		out.write("}");
		return null;
	}

	@Override
	public Void visit(PySubscript subscript) throws IOException {
		boolean opened = open(ATOM);
		write(subscript.getTarget(), ATOM);
		out.write("[");
		write(subscript.getIndex(), STATEMENT_CONTEXT);
		out.write("]");
		close(opened);
		return null;
	}

	@Override
	public Void visit(PySlice slice) throws IOException {
		boolean opened = open(ATOM);
		write(slice.getTarget(), ATOM);
		out.write("[");
		if (slice.getLower() != null) {
			write(slice.getLower(), STATEMENT_CONTEXT);
		}
		out.write(":");
		if (slice.getUpper() != null) {
			write(slice.getUpper(), STATEMENT_CONTEXT);
		}
		out.write("]");
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyAttribute attribute) throws IOException {
		boolean opened = open(ATOM);
		write(attribute.getTarget(), ATOM);
		out.write(".");
		out.write(attribute.getAttribute());
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyCall call) throws IOException {
		boolean opened = open(ATOM);
		write(call.getFunction(), ATOM);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, call.getArguments(), e -> write(e, ARGUMENT_CONTEXT));
		out.write(")");
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyBinop binop) throws IOException {
		PyBinop.Operation operation = binop.getOperation();
		int precedence = operation.getPrecedence();
		int lhsContext;
		int rhsContext;
		if (operation == PyBinop.Operation.POWER) {
			lhsContext = precedence + 1;
			rhsContext = precedence - 1;
		} else if (precedence == PyBinop.Operation.EQ.getPrecedence()) {
			// comparisons chain in Python, so neither side may be a bare comparison
			lhsContext = precedence + 1;
			rhsContext = precedence + 1;
		} else {
			lhsContext = precedence;
			rhsContext = precedence + 1;
		}
		boolean opened = open(precedence);
		write(binop.getLhs(), lhsContext);
		out.write(" ");
		out.write(operation.getSymbol());
		out.write(" ");
		write(binop.getRhs(), rhsContext);
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyUnary unary) throws IOException {
		int precedence = unary.getOperation().getPrecedence();
		boolean opened = open(precedence);
		out.write(unary.getOperation().getSymbol());
		write(unary.getOperand(), precedence);
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyIfExp ifExp) throws IOException {
		boolean opened = open(IF_EXP);
		write(ifExp.getBody(), IF_EXP + 1);
		out.write(" if ");
		write(ifExp.getTest(), IF_EXP + 1);
		out.write(" else ");
		write(ifExp.getOrElse(), IF_EXP);
		close(opened);
		return null;
	}

	@Override
	public Void visit(PyNamedExpr namedExpr) throws IOException {
		boolean opened = open(NAMED_EXPR);
		write(namedExpr.getTarget(), ATOM);
		out.write(" := ");
		write(namedExpr.getValue(), IF_EXP);
		close(opened);
		return null;
	}
}
