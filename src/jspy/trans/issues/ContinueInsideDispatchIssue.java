package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;

/**
 * A continue whose nearest enclosing jump target is a switch. Switches are lowered to a loop of their own, which
 * the continue would bind to instead of the intended loop.
 */
public class ContinueInsideDispatchIssue extends TranslationIssue {

	public static final String CODE = "E_CONTINUE_IN_SWITCH";

	public ContinueInsideDispatchIssue(JSNode node, String explanation, String suggestion) {
		super(CODE, node, explanation, suggestion);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
