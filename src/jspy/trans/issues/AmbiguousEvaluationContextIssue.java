package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;

/**
 * An ordering-sensitive construct in a position where it cannot be rewritten without changing evaluation order or
 * count.
 */
public class AmbiguousEvaluationContextIssue extends TranslationIssue {

	public static final String CODE = "E_AMBIGUOUS_EVALUATION_CONTEXT";

	public AmbiguousEvaluationContextIssue(JSNode node, String explanation, String suggestion) {
		super(CODE, node, explanation, suggestion);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
