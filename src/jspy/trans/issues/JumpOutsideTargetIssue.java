package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;

/**
 * A break with no enclosing loop or switch, or a continue with no enclosing loop.
 */
public class JumpOutsideTargetIssue extends TranslationIssue {

	public static final String CODE = "E_JUMP_OUTSIDE_TARGET";

	public JumpOutsideTargetIssue(JSNode node, String explanation, String suggestion) {
		super(CODE, node, explanation, suggestion);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
