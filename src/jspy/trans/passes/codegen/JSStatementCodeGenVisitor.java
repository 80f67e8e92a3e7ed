package jspy.trans.passes.codegen;

import jspy.model.js.*;
import jspy.model.py.*;
import jspy.model.py.builder.PyBlockBuilder;
import jspy.model.py.builder.PyIfBuilder;
import jspy.scope.ScopeResolver;
import jspy.trans.issues.AmbiguousFallThroughIssue;
import jspy.trans.issues.UnsupportedConstructIssue;
import jspy.trans.passes.structure.AssignedNamesCollector;
import jspy.trans.passes.structure.StructuralAnnotations;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates JavaScript statements into Python statements, appending them to a block builder.
 */
public class JSStatementCodeGenVisitor extends JSStatementVisitor<Void, RuntimeException> {

	private final CodeGenContext ctx;
	private final PyBlockBuilder builder;
	private final JSExpressionCodeGenVisitor exprs;

	public JSStatementCodeGenVisitor(CodeGenContext ctx, PyBlockBuilder builder) {
		this.ctx = ctx;
		this.builder = builder;
		this.exprs = new JSExpressionCodeGenVisitor(ctx);
	}

	private JSStatementCodeGenVisitor into(PyBlockBuilder other) {
		return new JSStatementCodeGenVisitor(ctx, other);
	}

	private void translateStatements(List<JSStatement> statements) {
		for (JSStatement statement : statements) {
			statement.accept(this);
		}
	}

	private void translateBody(JSStatement body) {
		body.accept(this);
	}

	/**
	 * Translates the body of the program or of a function declaration. The scope for the root must already be
	 * entered and its parameters declared.
	 *
	 * Output order: global/nonlocal declarations, hoisted variable stores, function definitions, then the
	 * remaining statements in source order.
	 */
	public void translateFunctionRoot(JSNode root, List<JSStatement> body, boolean isFunction) {
		StructuralAnnotations annotations = ctx.getAnnotations();
		ScopeResolver resolver = ctx.getResolver();
		Set<String> hoisted = annotations.getHoistedNames(root);
		for (String name : hoisted) {
			resolver.declare(name);
		}
		for (String name : annotations.getFunctionNames(root)) {
			resolver.declare(name);
		}
		if (isFunction) {
			declareOuterBindings(annotations.getFreeAssignedNames(root));
		} else if (!ctx.getOptions().isStrictBindings()) {
			// implicit globals
			for (String name : annotations.getFreeAssignedNames(root)) {
				resolver.declare(name);
			}
		}
		for (String name : hoisted) {
			builder.assign(new PyName(resolver.lookup(name)), ctx.getSymbols().runtime(PyRuntime.JS_UNDEFINED));
		}
		for (JSStatement statement : body) {
			if (statement instanceof JSFunctionDeclaration) {
				translateFunction((JSFunctionDeclaration) statement);
			}
		}
		for (JSStatement statement : body) {
			if (!(statement instanceof JSFunctionDeclaration)) {
				statement.accept(this);
			}
		}
	}

	private void declareOuterBindings(Set<String> freeAssigned) {
		ScopeResolver resolver = ctx.getResolver();
		List<String> globals = new ArrayList<>();
		List<String> nonlocals = new ArrayList<>();
		for (String name : freeAssigned) {
			switch (resolver.getBinding(name)) {
				case MODULE:
					globals.add(resolver.lookup(name));
					break;
				case ENCLOSING_FUNCTION:
					nonlocals.add(resolver.lookup(name));
					break;
				case UNDECLARED:
					// under strict bindings the assignment itself is reported
					if (!ctx.getOptions().isStrictBindings()) {
						globals.add(resolver.lookup(name));
					}
					break;
				case LOCAL:
					break;
			}
		}
		if (!globals.isEmpty()) {
			builder.globalStmt(globals, false);
		}
		if (!nonlocals.isEmpty()) {
			builder.globalStmt(nonlocals, true);
		}
	}

	private void translateFunction(JSFunctionDeclaration function) {
		ScopeResolver resolver = ctx.getResolver();
		TempAllocator temps = ctx.getTemps();
		String name = resolver.lookup(function.getName().getName());
		int mark = temps.mark();
		temps.reset();
		resolver.enterScope();
		try {
			List<String> params = new ArrayList<>();
			for (JSIdentifier param : function.getParams()) {
				params.add(resolver.declare(param.getName()));
			}
			try (PyBlockBuilder fn = builder.defineFunction(name, params)) {
				into(fn).translateFunctionRoot(function, function.getBody(), true);
			}
		} finally {
			resolver.exitScope();
			temps.restore(mark);
		}
	}

	/**
	 * Translates an expression evaluated only for its effects. Assignments and updates become plain statements,
	 * and comma sequences are split.
	 */
	private void translateEffect(JSExpression expression) {
		if (expression instanceof JSSequenceExpression) {
			for (JSExpression part : ((JSSequenceExpression) expression).getExpressions()) {
				translateEffect(part);
			}
		} else if (expression instanceof JSAssignmentExpression) {
			translateAssignment((JSAssignmentExpression) expression);
		} else if (expression instanceof JSUpdateExpression) {
			translateUpdate((JSUpdateExpression) expression);
		} else {
			builder.addStatement(exprs.translate(expression));
		}
	}

	private PyExpression compound(JSNode node, JSAssignmentExpression.Operator operator, PyExpression current,
	                              JSExpression value) {
		String helper = JSExpressionCodeGenVisitor.helperFor(node, operator.getBinaryOperator());
		return ctx.callRuntime(helper, current, exprs.translate(value));
	}

	private PyExpression stepped(JSUpdateExpression update, PyExpression current) {
		return ctx.callRuntime(update.isIncrement() ? PyRuntime.JS_ADD : PyRuntime.JS_SUB,
				ctx.callRuntime(PyRuntime.JS_TO_NUMBER, current), new PyNumberLiteral(1));
	}

	private void translateAssignment(JSAssignmentExpression assignment) {
		JSExpression target = assignment.getTarget();
		JSAssignmentExpression.Operator operator = assignment.getOperator();
		if (target instanceof JSIdentifier) {
			PyName name = ctx.resolveBinding((JSIdentifier) target);
			if (operator == JSAssignmentExpression.Operator.ASSIGN) {
				builder.assign(name, exprs.translate(assignment.getValue()));
			} else {
				builder.assign(name, compound(assignment, operator, name, assignment.getValue()));
			}
			return;
		}
		JSMemberExpression member = memberTarget(assignment, target);
		if (operator == JSAssignmentExpression.Operator.ASSIGN) {
			// Python evaluates the right-hand side before the subscript target
			Set<String> assignedByValue = new LinkedHashSet<>();
			new AssignedNamesCollector(assignedByValue).scan(assignment.getValue());
			boolean reorderSafe = assignedByValue.isEmpty();
			PyExpression base = exprs.translate(member.getObject());
			if (!reorderSafe || !JSExpressionCodeGenVisitor.isPure(member.getObject())) {
				base = bindTemp(base);
			}
			PyExpression key = exprs.memberKey(member);
			if (member.isComputed() && (!reorderSafe || !JSExpressionCodeGenVisitor.isPure(member.getProperty()))) {
				key = bindTemp(key);
			}
			builder.assign(new PySubscript(base, key), exprs.translate(assignment.getValue()));
			return;
		}
		PySubscript slot = singleEvaluationSlot(member);
		builder.assign(slot, compound(assignment, operator, slot, assignment.getValue()));
	}

	private void translateUpdate(JSUpdateExpression update) {
		JSExpression target = update.getArgument();
		if (target instanceof JSIdentifier) {
			PyName name = ctx.resolveBinding((JSIdentifier) target);
			builder.assign(name, stepped(update, name));
			return;
		}
		PySubscript slot = singleEvaluationSlot(memberTarget(update, target));
		builder.assign(slot, stepped(update, slot));
	}

	private JSMemberExpression memberTarget(JSExpression node, JSExpression target) {
		if (!(target instanceof JSMemberExpression)) {
			throw new UnsupportedConstructIssue(node, "invalid assignment target " + target.getKind(),
					"assign to a variable or an object property");
		}
		JSMemberExpression member = (JSMemberExpression) target;
		JSExpression object = member.getObject();
		if (object instanceof JSIdentifier && ctx.isKnownGlobal(((JSIdentifier) object).getName())) {
			throw new UnsupportedConstructIssue(node, "library objects cannot be modified",
					"store the value in a variable of your own");
		}
		if (!member.isComputed() && member.getPropertyName().equals("length")) {
			throw new UnsupportedConstructIssue(node, "assignment to length is not supported",
					"build a new array with the intended length");
		}
		return member;
	}

	/**
	 * Binds base and key of a property target to temps so that a read followed by a write evaluates each only
	 * once.
	 */
	private PySubscript singleEvaluationSlot(JSMemberExpression member) {
		PyExpression base = bindTemp(exprs.translate(member.getObject()));
		PyExpression key = exprs.memberKey(member);
		if (member.isComputed()) {
			key = bindTemp(key);
		}
		return new PySubscript(base, key);
	}

	private PyName bindTemp(PyExpression value) {
		PyName temp = ctx.freshTemp();
		builder.assign(temp, value);
		return temp;
	}

	private void registerLoop(JSStatement loop, List<PyStatement> continuePrelude) {
		ctx.setContinuePrelude(ctx.getAnnotations().getLoopId(loop), continuePrelude);
	}

	@Override
	public Void visit(JSExpressionStatement expressionStatement) {
		translateEffect(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(JSVariableDeclaration variableDeclaration) {
		if (variableDeclaration.getDeclarationKind() != JSVariableDeclaration.Kind.VAR) {
			throw new UnsupportedConstructIssue(variableDeclaration,
					"'" + variableDeclaration.getDeclarationKind().name().toLowerCase() + "' declarations are not supported",
					"declare the variable with 'var'");
		}
		for (JSVariableDeclarator declarator : variableDeclaration.getDeclarations()) {
			if (declarator.getInit() != null) {
				builder.assign(ctx.resolveBinding(declarator.getId()), exprs.translate(declarator.getInit()));
			}
		}
		return null;
	}

	@Override
	public Void visit(JSFunctionDeclaration functionDeclaration) {
		throw new UnsupportedConstructIssue(functionDeclaration,
				"function declarations are only supported at the top level of a program or function",
				"move the declaration out of the block");
	}

	@Override
	public Void visit(JSReturnStatement returnStatement) {
		if (returnStatement.getArgument() == null) {
			builder.returnStmt(ctx.getSymbols().runtime(PyRuntime.JS_UNDEFINED));
		} else {
			builder.returnStmt(exprs.translate(returnStatement.getArgument()));
		}
		return null;
	}

	@Override
	public Void visit(JSIfStatement ifStatement) {
		try (PyIfBuilder ifBuilder = builder.ifStmt(exprs.truthy(ifStatement.getTest()))) {
			try (PyBlockBuilder yes = ifBuilder.whenTrue()) {
				into(yes).translateBody(ifStatement.getConsequent());
			}
			if (ifStatement.getAlternate() != null) {
				try (PyBlockBuilder no = ifBuilder.whenFalse()) {
					into(no).translateBody(ifStatement.getAlternate());
				}
			}
		}
		return null;
	}

	@Override
	public Void visit(JSBlockStatement blockStatement) {
		translateStatements(blockStatement.getBody());
		return null;
	}

	@Override
	public Void visit(JSWhileStatement whileStatement) {
		registerLoop(whileStatement, Collections.emptyList());
		try (PyBlockBuilder loop = builder.whileLoop(exprs.truthy(whileStatement.getTest()))) {
			into(loop).translateBody(whileStatement.getBody());
		}
		return null;
	}

	@Override
	public Void visit(JSDoWhileStatement doWhileStatement) {
		PyBlockBuilder exitCheck = PyBlockBuilder.detached();
		try (PyIfBuilder check = exitCheck.ifStmt(
				new PyUnary(PyUnary.Operation.NOT, exprs.truthy(doWhileStatement.getTest())))) {
			try (PyBlockBuilder exit = check.whenTrue()) {
				exit.breakStmt();
			}
		}
		registerLoop(doWhileStatement, exitCheck.getStatements());
		try (PyBlockBuilder loop = builder.whileLoop(PyBuiltins.True)) {
			into(loop).translateBody(doWhileStatement.getBody());
			loop.addAll(exitCheck.getStatements());
		}
		return null;
	}

	@Override
	public Void visit(JSForStatement forStatement) {
		if (forStatement.getInitDeclaration() != null) {
			forStatement.getInitDeclaration().accept(this);
		}
		if (forStatement.getInitExpression() != null) {
			translateEffect(forStatement.getInitExpression());
		}
		PyExpression condition = forStatement.getTest() == null
				? PyBuiltins.True
				: exprs.truthy(forStatement.getTest());
		PyBlockBuilder update = PyBlockBuilder.detached();
		if (forStatement.getUpdate() != null) {
			into(update).translateEffect(forStatement.getUpdate());
		}
		registerLoop(forStatement, update.getStatements());
		try (PyBlockBuilder loop = builder.whileLoop(condition)) {
			into(loop).translateBody(forStatement.getBody());
			loop.addAll(update.getStatements());
		}
		return null;
	}

	@Override
	public Void visit(JSForInStatement forInStatement) {
		PyName target;
		if (forInStatement.getLeftDeclaration() != null) {
			JSVariableDeclaration declaration = forInStatement.getLeftDeclaration();
			if (declaration.getDeclarationKind() != JSVariableDeclaration.Kind.VAR) {
				throw new UnsupportedConstructIssue(declaration,
						"'" + declaration.getDeclarationKind().name().toLowerCase() + "' declarations are not supported",
						"declare the variable with 'var'");
			}
			target = ctx.resolveBinding(declaration.getDeclarations().get(0).getId());
		} else if (forInStatement.getLeftTarget() instanceof JSIdentifier) {
			target = ctx.resolveBinding((JSIdentifier) forInStatement.getLeftTarget());
		} else {
			throw new UnsupportedConstructIssue(forInStatement, "for-in over a property target is not supported",
					"enumerate into a variable and assign the property in the body");
		}
		PyExpression keys = ctx.callRuntime(PyRuntime.JS_FOR_IN_KEYS, exprs.translate(forInStatement.getRight()));
		registerLoop(forInStatement, Collections.emptyList());
		try (PyBlockBuilder loop = builder.forLoop(target, keys)) {
			into(loop).translateBody(forInStatement.getBody());
		}
		return null;
	}

	private static boolean isTerminated(List<JSStatement> statements) {
		if (statements.isEmpty()) {
			return false;
		}
		JSStatement last = statements.get(statements.size() - 1);
		if (last instanceof JSBlockStatement) {
			return isTerminated(((JSBlockStatement) last).getBody());
		}
		return last instanceof JSBreakStatement || last instanceof JSReturnStatement;
	}

	/**
	 * Case clauses that share one body: the alias clauses with empty bodies followed by the clause holding the
	 * body.
	 */
	private static final class CaseGroup {
		final List<JSExpression> tests = new ArrayList<>();
		List<JSStatement> body = Collections.emptyList();
		boolean isDefault;
	}

	private static List<CaseGroup> groupCases(JSSwitchStatement switchStatement) {
		List<CaseGroup> groups = new ArrayList<>();
		CaseGroup current = new CaseGroup();
		JSSwitchCase unterminated = null;
		for (JSSwitchCase switchCase : switchStatement.getCases()) {
			if (switchCase.isDefault()) {
				current.isDefault = true;
			} else {
				current.tests.add(switchCase.getTest());
			}
			if (switchCase.getConsequent().isEmpty()) {
				continue;
			}
			if (unterminated != null) {
				throw new AmbiguousFallThroughIssue(unterminated,
						"case falls through into the next case with a non-empty body",
						"end the case with 'break' or 'return', or merge the two case bodies");
			}
			current.body = switchCase.getConsequent();
			groups.add(current);
			current = new CaseGroup();
			if (!isTerminated(switchCase.getConsequent())) {
				unterminated = switchCase;
			}
		}
		if (!current.tests.isEmpty() || current.isDefault) {
			groups.add(current);
		}
		return groups;
	}

	private void translateCaseBody(PyBlockBuilder branch, List<JSStatement> body) {
		into(branch).translateStatements(body);
		if (!isTerminated(body)) {
			branch.breakStmt();
		}
	}

	@Override
	public Void visit(JSSwitchStatement switchStatement) {
		List<CaseGroup> groups = groupCases(switchStatement);
		PyName discriminant = new PyName(ctx.getTemps().nextSwitchDiscriminant());
		builder.assign(discriminant, exprs.translate(switchStatement.getDiscriminant()));

		CaseGroup defaultGroup = null;
		List<CaseGroup> matched = new ArrayList<>();
		for (CaseGroup group : groups) {
			if (group.isDefault) {
				defaultGroup = group;
			} else {
				matched.add(group);
			}
		}

		try (PyBlockBuilder dispatch = builder.whileLoop(PyBuiltins.True)) {
			translateDispatch(dispatch, discriminant, matched, 0, defaultGroup);
			dispatch.breakStmt();
		}
		return null;
	}

	private void translateDispatch(PyBlockBuilder out, PyName discriminant, List<CaseGroup> matched, int index,
	                               CaseGroup defaultGroup) {
		if (index == matched.size()) {
			if (defaultGroup != null) {
				translateCaseBody(out, defaultGroup.body);
			}
			return;
		}
		CaseGroup group = matched.get(index);
		PyExpression condition = null;
		for (JSExpression test : group.tests) {
			PyExpression check = ctx.callRuntime(PyRuntime.JS_STRICT_EQ, discriminant, exprs.translate(test));
			condition = condition == null ? check : new PyBinop(PyBinop.Operation.OR, condition, check);
		}
		try (PyIfBuilder branch = out.ifStmt(condition)) {
			try (PyBlockBuilder yes = branch.whenTrue()) {
				translateCaseBody(yes, group.body);
			}
			if (index + 1 < matched.size() || defaultGroup != null) {
				try (PyBlockBuilder no = branch.whenFalse()) {
					translateDispatch(no, discriminant, matched, index + 1, defaultGroup);
				}
			}
		}
	}

	@Override
	public Void visit(JSBreakStatement breakStatement) {
		builder.breakStmt();
		return null;
	}

	@Override
	public Void visit(JSContinueStatement continueStatement) {
		Integer loopId = ctx.getAnnotations().getEnclosingLoopId(continueStatement);
		builder.addAll(ctx.getContinuePrelude(loopId));
		builder.continueStmt();
		return null;
	}

	@Override
	public Void visit(JSEmptyStatement emptyStatement) {
		return null;
	}

	@Override
	public Void visit(JSThrowStatement throwStatement) {
		throw new UnsupportedConstructIssue(throwStatement, "'throw' is not supported",
				"return an error value instead");
	}

	@Override
	public Void visit(JSTryStatement tryStatement) {
		throw new UnsupportedConstructIssue(tryStatement, "'try' is not supported",
				"check for error conditions explicitly");
	}

	@Override
	public Void visit(JSLabeledStatement labeledStatement) {
		throw new UnsupportedConstructIssue(labeledStatement, "labelled statements are not supported",
				"restructure the loops so that no label is needed");
	}
}
