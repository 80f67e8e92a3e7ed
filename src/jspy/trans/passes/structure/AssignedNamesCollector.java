package jspy.trans.passes.structure;

import jspy.model.js.*;

import java.util.Set;

/**
 * Collects the identifiers an expression assigns to, through plain or compound assignment and update operators.
 * Function expressions are not entered.
 */
public class AssignedNamesCollector extends JSExpressionVisitor<Void, RuntimeException> {

	private final Set<String> assigned;

	public AssignedNamesCollector(Set<String> assigned) {
		this.assigned = assigned;
	}

	public void scan(JSExpression expression) {
		if (expression != null) {
			expression.accept(this);
		}
	}

	private void target(JSExpression target) {
		if (target instanceof JSIdentifier) {
			assigned.add(((JSIdentifier) target).getName());
		} else {
			target.accept(this);
		}
	}

	@Override
	public Void visit(JSNumberLiteral numberLiteral) {
		return null;
	}

	@Override
	public Void visit(JSStringLiteral stringLiteral) {
		return null;
	}

	@Override
	public Void visit(JSBooleanLiteral booleanLiteral) {
		return null;
	}

	@Override
	public Void visit(JSNullLiteral nullLiteral) {
		return null;
	}

	@Override
	public Void visit(JSRegExpLiteral regExpLiteral) {
		return null;
	}

	@Override
	public Void visit(JSIdentifier identifier) {
		return null;
	}

	@Override
	public Void visit(JSThis jsThis) {
		return null;
	}

	@Override
	public Void visit(JSArrayLiteral arrayLiteral) {
		for (JSExpression element : arrayLiteral.getElements()) {
			scan(element);
		}
		return null;
	}

	@Override
	public Void visit(JSObjectLiteral objectLiteral) {
		for (JSObjectProperty property : objectLiteral.getProperties()) {
			scan(property.getValue());
		}
		return null;
	}

	@Override
	public Void visit(JSMemberExpression memberExpression) {
		scan(memberExpression.getObject());
		if (memberExpression.isComputed()) {
			scan(memberExpression.getProperty());
		}
		return null;
	}

	@Override
	public Void visit(JSCallExpression callExpression) {
		scan(callExpression.getCallee());
		for (JSExpression argument : callExpression.getArguments()) {
			scan(argument);
		}
		return null;
	}

	@Override
	public Void visit(JSNewExpression newExpression) {
		scan(newExpression.getCallee());
		for (JSExpression argument : newExpression.getArguments()) {
			scan(argument);
		}
		return null;
	}

	@Override
	public Void visit(JSUnaryExpression unaryExpression) {
		scan(unaryExpression.getArgument());
		return null;
	}

	@Override
	public Void visit(JSUpdateExpression updateExpression) {
		target(updateExpression.getArgument());
		return null;
	}

	@Override
	public Void visit(JSBinaryExpression binaryExpression) {
		scan(binaryExpression.getLeft());
		scan(binaryExpression.getRight());
		return null;
	}

	@Override
	public Void visit(JSLogicalExpression logicalExpression) {
		scan(logicalExpression.getLeft());
		scan(logicalExpression.getRight());
		return null;
	}

	@Override
	public Void visit(JSConditionalExpression conditionalExpression) {
		scan(conditionalExpression.getTest());
		scan(conditionalExpression.getConsequent());
		scan(conditionalExpression.getAlternate());
		return null;
	}

	@Override
	public Void visit(JSAssignmentExpression assignmentExpression) {
		target(assignmentExpression.getTarget());
		scan(assignmentExpression.getValue());
		return null;
	}

	@Override
	public Void visit(JSSequenceExpression sequenceExpression) {
		for (JSExpression expression : sequenceExpression.getExpressions()) {
			scan(expression);
		}
		return null;
	}

	@Override
	public Void visit(JSFunctionExpression functionExpression) {
		return null;
	}
}
