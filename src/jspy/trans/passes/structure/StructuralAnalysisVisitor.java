package jspy.trans.passes.structure;

import jspy.model.js.*;
import jspy.trans.issues.ContinueInsideDispatchIssue;
import jspy.trans.issues.JumpOutsideTargetIssue;
import jspy.trans.issues.UnsupportedConstructIssue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class StructuralAnalysisVisitor extends JSStatementVisitor<Void, RuntimeException> {

	// marks a switch on the jump target stack; loop ids start at 1
	private static final int DISPATCH = 0;

	private static final class FunctionFrame {
		final Set<String> params = new HashSet<>();
		final Set<String> hoisted = new LinkedHashSet<>();
		final Set<String> functions = new LinkedHashSet<>();
		final Set<String> assigned = new LinkedHashSet<>();
	}

	private final StructuralAnnotations annotations;
	private Deque<Integer> targets;
	private FunctionFrame frame;
	private int nextLoopId;

	public StructuralAnalysisVisitor(StructuralAnnotations annotations) {
		this.annotations = annotations;
		this.targets = new ArrayDeque<>();
		this.frame = null;
		this.nextLoopId = 1;
	}

	void visitFunctionRoot(JSNode root, List<JSStatement> body, List<JSIdentifier> params) {
		Deque<Integer> savedTargets = targets;
		FunctionFrame savedFrame = frame;
		targets = new ArrayDeque<>();
		frame = new FunctionFrame();
		try {
			for (JSIdentifier param : params) {
				frame.params.add(param.getName());
			}
			visitAll(body);
			Set<String> free = new LinkedHashSet<>(frame.assigned);
			free.removeAll(frame.params);
			free.removeAll(frame.hoisted);
			free.removeAll(frame.functions);
			annotations.setFunctionRoot(root, frame.hoisted, frame.functions, free);
		} finally {
			targets = savedTargets;
			frame = savedFrame;
		}
	}

	private void visitAll(List<JSStatement> statements) {
		for (JSStatement statement : statements) {
			visitStatement(statement);
		}
	}

	private void visitStatement(JSStatement statement) {
		if (statement == null) {
			return;
		}
		annotations.setEnclosingLoopId(statement, innermostLoop());
		if (!targets.isEmpty() && targets.peek() == DISPATCH) {
			annotations.setInsideDispatch(statement);
		}
		statement.accept(this);
	}

	private Integer innermostLoop() {
		for (int target : targets) {
			if (target != DISPATCH) {
				return target;
			}
		}
		return null;
	}

	private void scan(JSExpression expression) {
		new AssignedNamesCollector(frame.assigned).scan(expression);
	}

	private void declare(JSVariableDeclaration declaration) {
		for (JSVariableDeclarator declarator : declaration.getDeclarations()) {
			String name = declarator.getId().getName();
			if (declaration.getDeclarationKind() == JSVariableDeclaration.Kind.VAR && !frame.params.contains(name)) {
				frame.hoisted.add(name);
			}
			scan(declarator.getInit());
		}
	}

	private void loopBody(JSStatement loop, JSStatement body) {
		int id = nextLoopId++;
		annotations.setLoopId(loop, id);
		targets.push(id);
		try {
			visitStatement(body);
		} finally {
			targets.pop();
		}
	}

	@Override
	public Void visit(JSExpressionStatement expressionStatement) {
		scan(expressionStatement.getExpression());
		return null;
	}

	@Override
	public Void visit(JSVariableDeclaration variableDeclaration) {
		declare(variableDeclaration);
		return null;
	}

	@Override
	public Void visit(JSFunctionDeclaration functionDeclaration) {
		frame.functions.add(functionDeclaration.getName().getName());
		visitFunctionRoot(functionDeclaration, functionDeclaration.getBody(), functionDeclaration.getParams());
		return null;
	}

	@Override
	public Void visit(JSReturnStatement returnStatement) {
		scan(returnStatement.getArgument());
		return null;
	}

	@Override
	public Void visit(JSIfStatement ifStatement) {
		scan(ifStatement.getTest());
		visitStatement(ifStatement.getConsequent());
		visitStatement(ifStatement.getAlternate());
		return null;
	}

	@Override
	public Void visit(JSBlockStatement blockStatement) {
		visitAll(blockStatement.getBody());
		return null;
	}

	@Override
	public Void visit(JSWhileStatement whileStatement) {
		scan(whileStatement.getTest());
		loopBody(whileStatement, whileStatement.getBody());
		return null;
	}

	@Override
	public Void visit(JSDoWhileStatement doWhileStatement) {
		loopBody(doWhileStatement, doWhileStatement.getBody());
		scan(doWhileStatement.getTest());
		return null;
	}

	@Override
	public Void visit(JSForStatement forStatement) {
		if (forStatement.getInitDeclaration() != null) {
			declare(forStatement.getInitDeclaration());
		}
		scan(forStatement.getInitExpression());
		scan(forStatement.getTest());
		scan(forStatement.getUpdate());
		loopBody(forStatement, forStatement.getBody());
		return null;
	}

	@Override
	public Void visit(JSForInStatement forInStatement) {
		if (forInStatement.getLeftDeclaration() != null) {
			declare(forInStatement.getLeftDeclaration());
		} else if (forInStatement.getLeftTarget() instanceof JSIdentifier) {
			frame.assigned.add(((JSIdentifier) forInStatement.getLeftTarget()).getName());
		}
		scan(forInStatement.getRight());
		loopBody(forInStatement, forInStatement.getBody());
		return null;
	}

	@Override
	public Void visit(JSSwitchStatement switchStatement) {
		scan(switchStatement.getDiscriminant());
		targets.push(DISPATCH);
		try {
			for (JSSwitchCase switchCase : switchStatement.getCases()) {
				scan(switchCase.getTest());
				visitAll(switchCase.getConsequent());
			}
		} finally {
			targets.pop();
		}
		return null;
	}

	@Override
	public Void visit(JSBreakStatement breakStatement) {
		if (breakStatement.getLabel() != null) {
			throw new UnsupportedConstructIssue(breakStatement, "labelled break is not supported",
					"restructure the loops so that an unlabelled break suffices");
		}
		if (targets.isEmpty()) {
			throw new JumpOutsideTargetIssue(breakStatement, "break outside of any loop or switch",
					"remove the break or move it inside a loop or switch");
		}
		return null;
	}

	@Override
	public Void visit(JSContinueStatement continueStatement) {
		if (continueStatement.getLabel() != null) {
			throw new UnsupportedConstructIssue(continueStatement, "labelled continue is not supported",
					"restructure the loops so that an unlabelled continue suffices");
		}
		if (innermostLoop() == null) {
			throw new JumpOutsideTargetIssue(continueStatement, "continue outside of any loop",
					"remove the continue or move it inside a loop");
		}
		if (targets.peek() == DISPATCH) {
			throw new ContinueInsideDispatchIssue(continueStatement,
					"continue inside a switch statement is not supported",
					"set a flag and break out of the switch, then continue after it");
		}
		return null;
	}

	@Override
	public Void visit(JSEmptyStatement emptyStatement) {
		return null;
	}

	@Override
	public Void visit(JSThrowStatement throwStatement) {
		scan(throwStatement.getArgument());
		return null;
	}

	@Override
	public Void visit(JSTryStatement tryStatement) {
		visitStatement(tryStatement.getBlock());
		visitStatement(tryStatement.getHandler());
		visitStatement(tryStatement.getFinalizer());
		return null;
	}

	@Override
	public Void visit(JSLabeledStatement labeledStatement) {
		visitStatement(labeledStatement.getBody());
		return null;
	}
}
