package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;

/**
 * A non-empty switch case without a terminator followed by another non-empty case.
 */
public class AmbiguousFallThroughIssue extends TranslationIssue {

	public static final String CODE = "E_SWITCH_FALLTHROUGH";

	public AmbiguousFallThroughIssue(JSNode node, String explanation, String suggestion) {
		super(CODE, node, explanation, suggestion);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
