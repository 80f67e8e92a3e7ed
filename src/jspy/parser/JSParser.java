package jspy.parser;

import jspy.model.js.*;
import jspy.trans.issues.UnsupportedConstructIssue;
import jspy.util.SourceLocation;
import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.ErrorReporter;
import org.mozilla.javascript.EvaluatorException;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.Token;
import org.mozilla.javascript.ast.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Front end for JavaScript source. Parsing itself is delegated to Rhino; this class converts Rhino's mutable AST
 * into the immutable {@link JSProgram} model consumed by the translation passes.
 *
 * Rhino nodes with no counterpart in the model are rejected with an {@link UnsupportedConstructIssue}.
 */
public final class JSParser {

	private final Path file;
	private final CharSequence source;

	private JSParser(Path file, CharSequence source) {
		this.file = file;
		this.source = source;
	}

	private static final class ThrowingErrorReporter implements ErrorReporter {
		@Override
		public void warning(String message, String sourceName, int line, String lineSource, int lineOffset) {
			// Rhino warnings (e.g. missing semicolons in strict mode) never change the parse result
		}

		@Override
		public void error(String message, String sourceName, int line, String lineSource, int lineOffset) {
			throw runtimeError(message, sourceName, line, lineSource, lineOffset);
		}

		@Override
		public EvaluatorException runtimeError(String message, String sourceName, int line, String lineSource,
		                                       int lineOffset) {
			return new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
		}
	}

	public static JSProgram parse(Path file, CharSequence source) throws ParsingError {
		CompilerEnvirons env = new CompilerEnvirons();
		env.setLanguageVersion(Context.VERSION_1_8);
		env.setRecordingComments(false);
		env.setRecordingLocalJsDocComments(false);
		env.setIdeMode(false);
		ThrowingErrorReporter reporter = new ThrowingErrorReporter();
		env.setErrorReporter(reporter);
		Parser parser = new Parser(env, reporter);
		JSParser converter = new JSParser(file, source);
		AstRoot root;
		try {
			root = parser.parse(source.toString(), file.toString(), 1);
		} catch (EvaluatorException e) {
			throw new ParsingError(converter.locationOf(e.lineNumber(), e.columnNumber()), e.details(), e);
		}
		if (root == null) {
			throw new ParsingError(converter.locationOf(1, 0), "unable to parse JavaScript source");
		}
		return converter.program(root);
	}

	private SourceLocation locationOf(AstNode node) {
		int start = node.getAbsolutePosition();
		return SourceLocation.fromOffsets(file, source, start, start + node.getLength());
	}

	// line is 1-based as reported by Rhino, column may be 0 when unknown
	private SourceLocation locationOf(int line, int column) {
		int offset = 0;
		int currentLine = 1;
		while (currentLine < line && offset < source.length()) {
			if (source.charAt(offset) == '\n') {
				currentLine++;
			}
			offset++;
		}
		offset = Math.min(source.length(), offset + Math.max(0, column - 1));
		return SourceLocation.fromOffsets(file, source, offset, offset);
	}

	private UnsupportedConstructIssue unsupported(AstNode node, String what) {
		return new UnsupportedConstructIssue(node.getClass().getSimpleName(), locationOf(node),
				what + " is not supported", "rewrite the code using the supported ES5 subset");
	}

	private JSProgram program(AstRoot root) {
		return new JSProgram(locationOf(root), statements(root));
	}

	private List<JSStatement> statements(Node parent) {
		List<JSStatement> result = new ArrayList<>();
		if (parent == null) {
			return result;
		}
		for (Node child : parent) {
			result.add(statement((AstNode) child));
		}
		return result;
	}

	private List<JSStatement> statementList(List<AstNode> nodes) {
		List<JSStatement> result = new ArrayList<>();
		if (nodes == null) {
			return result;
		}
		for (AstNode node : nodes) {
			result.add(statement(node));
		}
		return result;
	}

	private JSStatement statement(AstNode node) {
		SourceLocation loc = locationOf(node);
		if (node instanceof FunctionNode) {
			FunctionNode fn = (FunctionNode) node;
			if (fn.getFunctionName() == null) {
				throw unsupported(node, "an anonymous function in statement position");
			}
			return new JSFunctionDeclaration(loc, identifier(fn.getFunctionName()), params(fn),
					statements(fn.getBody()));
		} else if (node instanceof ExpressionStatement) {
			AstNode expr = ((ExpressionStatement) node).getExpression();
			if (expr instanceof EmptyExpression) {
				return new JSEmptyStatement(loc);
			}
			if (expr instanceof FunctionNode &&
					((FunctionNode) expr).getFunctionType() == FunctionNode.FUNCTION_EXPRESSION_STATEMENT) {
				return statement(expr);
			}
			if (expr instanceof VariableDeclaration) {
				return variableDeclaration((VariableDeclaration) expr);
			}
			return new JSExpressionStatement(loc, expression(expr));
		} else if (node instanceof VariableDeclaration) {
			return variableDeclaration((VariableDeclaration) node);
		} else if (node instanceof ReturnStatement) {
			AstNode value = ((ReturnStatement) node).getReturnValue();
			return new JSReturnStatement(loc, value == null ? null : expression(value));
		} else if (node instanceof IfStatement) {
			IfStatement ifStatement = (IfStatement) node;
			AstNode elsePart = ifStatement.getElsePart();
			return new JSIfStatement(loc, expression(ifStatement.getCondition()),
					statement(ifStatement.getThenPart()), elsePart == null ? null : statement(elsePart));
		} else if (node instanceof WhileLoop) {
			WhileLoop loop = (WhileLoop) node;
			return new JSWhileStatement(loc, expression(loop.getCondition()), statement(loop.getBody()));
		} else if (node instanceof DoLoop) {
			DoLoop loop = (DoLoop) node;
			return new JSDoWhileStatement(loc, statement(loop.getBody()), expression(loop.getCondition()));
		} else if (node instanceof ForInLoop) {
			return forIn((ForInLoop) node);
		} else if (node instanceof ForLoop) {
			return forLoop((ForLoop) node);
		} else if (node instanceof SwitchStatement) {
			SwitchStatement switchStatement = (SwitchStatement) node;
			List<JSSwitchCase> cases = new ArrayList<>();
			for (SwitchCase switchCase : switchStatement.getCases()) {
				cases.add(new JSSwitchCase(locationOf(switchCase),
						switchCase.isDefault() ? null : expression(switchCase.getExpression()),
						statementList(switchCase.getStatements())));
			}
			return new JSSwitchStatement(loc, expression(switchStatement.getExpression()), cases);
		} else if (node instanceof BreakStatement) {
			Name label = ((BreakStatement) node).getBreakLabel();
			return new JSBreakStatement(loc, label == null ? null : label.getIdentifier());
		} else if (node instanceof ContinueStatement) {
			Name label = ((ContinueStatement) node).getLabel();
			return new JSContinueStatement(loc, label == null ? null : label.getIdentifier());
		} else if (node instanceof EmptyStatement || node instanceof EmptyExpression) {
			return new JSEmptyStatement(loc);
		} else if (node instanceof ThrowStatement) {
			return new JSThrowStatement(loc, expression(((ThrowStatement) node).getExpression()));
		} else if (node instanceof TryStatement) {
			TryStatement tryStatement = (TryStatement) node;
			JSIdentifier catchParameter = null;
			JSBlockStatement handler = null;
			List<CatchClause> catches = tryStatement.getCatchClauses();
			if (catches != null && !catches.isEmpty()) {
				CatchClause clause = catches.get(0);
				catchParameter = clause.getVarName() == null ? null : identifier(clause.getVarName());
				handler = block(clause.getBody());
			}
			AstNode finallyBlock = tryStatement.getFinallyBlock();
			return new JSTryStatement(loc, block(tryStatement.getTryBlock()), catchParameter, handler,
					finallyBlock == null ? null : block(finallyBlock));
		} else if (node instanceof LabeledStatement) {
			LabeledStatement labeled = (LabeledStatement) node;
			return new JSLabeledStatement(loc, labeled.getLabels().get(0).getName(),
					statement(labeled.getStatement()));
		} else if (node instanceof Block || node instanceof Scope) {
			return new JSBlockStatement(loc, statements(node));
		}
		throw unsupported(node, "statement kind " + node.getClass().getSimpleName());
	}

	private JSBlockStatement block(AstNode node) {
		return new JSBlockStatement(locationOf(node), statements(node));
	}

	private JSVariableDeclaration variableDeclaration(VariableDeclaration declaration) {
		JSVariableDeclaration.Kind kind;
		if (declaration.isConst()) {
			kind = JSVariableDeclaration.Kind.CONST;
		} else if (declaration.isLet()) {
			kind = JSVariableDeclaration.Kind.LET;
		} else {
			kind = JSVariableDeclaration.Kind.VAR;
		}
		List<JSVariableDeclarator> declarators = new ArrayList<>();
		for (VariableInitializer initializer : declaration.getVariables()) {
			if (!(initializer.getTarget() instanceof Name)) {
				throw unsupported(initializer.getTarget(), "destructuring declaration");
			}
			AstNode init = initializer.getInitializer();
			declarators.add(new JSVariableDeclarator(locationOf(initializer),
					identifier((Name) initializer.getTarget()), init == null ? null : expression(init)));
		}
		return new JSVariableDeclaration(locationOf(declaration), kind, declarators);
	}

	private JSForStatement forLoop(ForLoop loop) {
		JSVariableDeclaration initDeclaration = null;
		JSExpression initExpression = null;
		AstNode init = loop.getInitializer();
		if (init instanceof VariableDeclaration) {
			initDeclaration = variableDeclaration((VariableDeclaration) init);
		} else if (init != null && !(init instanceof EmptyExpression)) {
			initExpression = expression(init);
		}
		return new JSForStatement(locationOf(loop), initDeclaration, initExpression,
				optionalExpression(loop.getCondition()), optionalExpression(loop.getIncrement()),
				statement(loop.getBody()));
	}

	private JSForInStatement forIn(ForInLoop loop) {
		if (loop.isForEach()) {
			throw unsupported(loop, "for each");
		}
		JSVariableDeclaration leftDeclaration = null;
		JSExpression leftTarget = null;
		AstNode iterator = loop.getIterator();
		if (iterator instanceof VariableDeclaration) {
			leftDeclaration = variableDeclaration((VariableDeclaration) iterator);
		} else {
			leftTarget = expression(iterator);
		}
		return new JSForInStatement(locationOf(loop), leftDeclaration, leftTarget,
				expression(loop.getIteratedObject()), statement(loop.getBody()));
	}

	private JSExpression optionalExpression(AstNode node) {
		if (node == null || node instanceof EmptyExpression) {
			return null;
		}
		return expression(node);
	}

	private JSIdentifier identifier(Name name) {
		return new JSIdentifier(locationOf(name), name.getIdentifier());
	}

	private List<JSIdentifier> params(FunctionNode fn) {
		List<JSIdentifier> result = new ArrayList<>();
		for (AstNode param : fn.getParams()) {
			if (!(param instanceof Name)) {
				throw unsupported(param, "destructuring parameter");
			}
			result.add(identifier((Name) param));
		}
		return result;
	}

	private List<JSExpression> expressions(List<AstNode> nodes) {
		List<JSExpression> result = new ArrayList<>();
		for (AstNode node : nodes) {
			result.add(expression(node));
		}
		return result;
	}

	private void flattenComma(AstNode node, List<JSExpression> into) {
		if (node instanceof InfixExpression && node.getType() == Token.COMMA) {
			InfixExpression infix = (InfixExpression) node;
			flattenComma(infix.getLeft(), into);
			flattenComma(infix.getRight(), into);
		} else {
			into.add(expression(node));
		}
	}

	private String propertyKey(AstNode key) {
		if (key instanceof Name) {
			return ((Name) key).getIdentifier();
		} else if (key instanceof StringLiteral) {
			return ((StringLiteral) key).getValue();
		} else if (key instanceof NumberLiteral) {
			double value = ((NumberLiteral) key).getNumber();
			if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e21) {
				return Long.toString((long) value);
			}
			return Double.toString(value);
		}
		throw unsupported(key, "computed property key");
	}

	private JSExpression expression(AstNode node) {
		SourceLocation loc = locationOf(node);
		if (node instanceof ParenthesizedExpression) {
			return expression(((ParenthesizedExpression) node).getExpression());
		} else if (node instanceof Name) {
			return new JSIdentifier(loc, ((Name) node).getIdentifier());
		} else if (node instanceof NumberLiteral) {
			NumberLiteral number = (NumberLiteral) node;
			return new JSNumberLiteral(loc, number.getNumber(), number.getValue());
		} else if (node instanceof StringLiteral) {
			return new JSStringLiteral(loc, ((StringLiteral) node).getValue());
		} else if (node instanceof KeywordLiteral) {
			switch (node.getType()) {
				case Token.NULL:
					return new JSNullLiteral(loc);
				case Token.TRUE:
					return new JSBooleanLiteral(loc, true);
				case Token.FALSE:
					return new JSBooleanLiteral(loc, false);
				case Token.THIS:
					return new JSThis(loc);
				default:
					throw unsupported(node, "keyword " + Token.typeToName(node.getType()));
			}
		} else if (node instanceof RegExpLiteral) {
			RegExpLiteral regExp = (RegExpLiteral) node;
			return new JSRegExpLiteral(loc, regExp.getValue(), regExp.getFlags() == null ? "" : regExp.getFlags());
		} else if (node instanceof ArrayLiteral) {
			List<JSExpression> elements = new ArrayList<>();
			for (AstNode element : ((ArrayLiteral) node).getElements()) {
				elements.add(element instanceof EmptyExpression ? null : expression(element));
			}
			return new JSArrayLiteral(loc, Collections.unmodifiableList(elements));
		} else if (node instanceof ObjectLiteral) {
			List<JSObjectProperty> properties = new ArrayList<>();
			for (ObjectProperty property : ((ObjectLiteral) node).getElements()) {
				JSObjectProperty.Kind kind;
				if (property.getType() == Token.GET) {
					kind = JSObjectProperty.Kind.GET;
				} else if (property.getType() == Token.SET) {
					kind = JSObjectProperty.Kind.SET;
				} else {
					kind = JSObjectProperty.Kind.INIT;
				}
				properties.add(new JSObjectProperty(locationOf(property), propertyKey(property.getLeft()),
						expression(property.getRight()), kind));
			}
			return new JSObjectLiteral(loc, properties);
		} else if (node instanceof PropertyGet) {
			PropertyGet get = (PropertyGet) node;
			return new JSMemberExpression(loc, expression(get.getTarget()), identifier(get.getProperty()), false);
		} else if (node instanceof ElementGet) {
			ElementGet get = (ElementGet) node;
			return new JSMemberExpression(loc, expression(get.getTarget()), expression(get.getElement()), true);
		} else if (node instanceof NewExpression) {
			NewExpression call = (NewExpression) node;
			return new JSNewExpression(loc, expression(call.getTarget()), expressions(call.getArguments()));
		} else if (node instanceof FunctionCall) {
			FunctionCall call = (FunctionCall) node;
			return new JSCallExpression(loc, expression(call.getTarget()), expressions(call.getArguments()));
		} else if (node instanceof ConditionalExpression) {
			ConditionalExpression conditional = (ConditionalExpression) node;
			return new JSConditionalExpression(loc, expression(conditional.getTestExpression()),
					expression(conditional.getTrueExpression()), expression(conditional.getFalseExpression()));
		} else if (node instanceof FunctionNode) {
			FunctionNode fn = (FunctionNode) node;
			return new JSFunctionExpression(loc,
					fn.getFunctionName() == null ? null : fn.getFunctionName().getIdentifier(),
					params(fn), statements(fn.getBody()));
		} else if (node instanceof UpdateExpression) {
			UpdateExpression update = (UpdateExpression) node;
			return new JSUpdateExpression(loc, update.getType() == Token.INC, !update.isPostfix(),
					expression(update.getOperand()));
		} else if (node instanceof UnaryExpression) {
			return unary((UnaryExpression) node);
		} else if (node instanceof Assignment) {
			Assignment assignment = (Assignment) node;
			return new JSAssignmentExpression(loc, assignmentOperator(assignment),
					expression(assignment.getLeft()), expression(assignment.getRight()));
		} else if (node instanceof InfixExpression) {
			InfixExpression infix = (InfixExpression) node;
			switch (infix.getType()) {
				case Token.COMMA: {
					List<JSExpression> parts = new ArrayList<>();
					flattenComma(infix, parts);
					return new JSSequenceExpression(loc, parts);
				}
				case Token.AND:
					return new JSLogicalExpression(loc, JSLogicalExpression.Operator.AND,
							expression(infix.getLeft()), expression(infix.getRight()));
				case Token.OR:
					return new JSLogicalExpression(loc, JSLogicalExpression.Operator.OR,
							expression(infix.getLeft()), expression(infix.getRight()));
				default:
					return new JSBinaryExpression(loc, binaryOperator(infix),
							expression(infix.getLeft()), expression(infix.getRight()));
			}
		}
		throw unsupported(node, "expression kind " + node.getClass().getSimpleName());
	}

	private JSExpression unary(UnaryExpression unary) {
		SourceLocation loc = locationOf(unary);
		JSExpression operand = expression(unary.getOperand());
		JSUnaryExpression.Operator operator;
		switch (unary.getType()) {
			case Token.NOT:
				operator = JSUnaryExpression.Operator.NOT;
				break;
			case Token.NEG:
				operator = JSUnaryExpression.Operator.NEGATE;
				break;
			case Token.POS:
				operator = JSUnaryExpression.Operator.PLUS;
				break;
			case Token.BITNOT:
				operator = JSUnaryExpression.Operator.BITWISE_NOT;
				break;
			case Token.TYPEOF:
				operator = JSUnaryExpression.Operator.TYPEOF;
				break;
			case Token.DELPROP:
				operator = JSUnaryExpression.Operator.DELETE;
				break;
			case Token.VOID:
				operator = JSUnaryExpression.Operator.VOID;
				break;
			default:
				throw unsupported(unary, "unary operator " + Token.typeToName(unary.getType()));
		}
		return new JSUnaryExpression(loc, operator, operand);
	}

	private JSBinaryExpression.Operator binaryOperator(InfixExpression infix) {
		switch (infix.getType()) {
			case Token.ADD:
				return JSBinaryExpression.Operator.ADD;
			case Token.SUB:
				return JSBinaryExpression.Operator.SUB;
			case Token.MUL:
				return JSBinaryExpression.Operator.MUL;
			case Token.DIV:
				return JSBinaryExpression.Operator.DIV;
			case Token.MOD:
				return JSBinaryExpression.Operator.MOD;
			case Token.SHEQ:
				return JSBinaryExpression.Operator.STRICT_EQ;
			case Token.SHNE:
				return JSBinaryExpression.Operator.STRICT_NEQ;
			case Token.EQ:
				return JSBinaryExpression.Operator.EQ;
			case Token.NE:
				return JSBinaryExpression.Operator.NEQ;
			case Token.LT:
				return JSBinaryExpression.Operator.LT;
			case Token.LE:
				return JSBinaryExpression.Operator.LE;
			case Token.GT:
				return JSBinaryExpression.Operator.GT;
			case Token.GE:
				return JSBinaryExpression.Operator.GE;
			case Token.BITAND:
				return JSBinaryExpression.Operator.BIT_AND;
			case Token.BITOR:
				return JSBinaryExpression.Operator.BIT_OR;
			case Token.BITXOR:
				return JSBinaryExpression.Operator.BIT_XOR;
			case Token.LSH:
				return JSBinaryExpression.Operator.LSH;
			case Token.RSH:
				return JSBinaryExpression.Operator.RSH;
			case Token.URSH:
				return JSBinaryExpression.Operator.URSH;
			case Token.IN:
				return JSBinaryExpression.Operator.IN;
			case Token.INSTANCEOF:
				return JSBinaryExpression.Operator.INSTANCEOF;
			default:
				throw unsupported(infix, "binary operator " + Token.typeToName(infix.getType()));
		}
	}

	private JSAssignmentExpression.Operator assignmentOperator(Assignment assignment) {
		switch (assignment.getType()) {
			case Token.ASSIGN:
				return JSAssignmentExpression.Operator.ASSIGN;
			case Token.ASSIGN_ADD:
				return JSAssignmentExpression.Operator.ADD;
			case Token.ASSIGN_SUB:
				return JSAssignmentExpression.Operator.SUB;
			case Token.ASSIGN_MUL:
				return JSAssignmentExpression.Operator.MUL;
			case Token.ASSIGN_DIV:
				return JSAssignmentExpression.Operator.DIV;
			case Token.ASSIGN_MOD:
				return JSAssignmentExpression.Operator.MOD;
			case Token.ASSIGN_BITAND:
				return JSAssignmentExpression.Operator.BIT_AND;
			case Token.ASSIGN_BITOR:
				return JSAssignmentExpression.Operator.BIT_OR;
			case Token.ASSIGN_BITXOR:
				return JSAssignmentExpression.Operator.BIT_XOR;
			case Token.ASSIGN_LSH:
				return JSAssignmentExpression.Operator.LSH;
			case Token.ASSIGN_RSH:
				return JSAssignmentExpression.Operator.RSH;
			case Token.ASSIGN_URSH:
				return JSAssignmentExpression.Operator.URSH;
			default:
				throw unsupported(assignment, "assignment operator " + Token.typeToName(assignment.getType()));
		}
	}
}
