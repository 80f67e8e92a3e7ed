package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;
import jspy.util.SourceLocation;

/**
 * A node kind, or a combination of node kind and feature, that has no rewrite rule.
 */
public class UnsupportedConstructIssue extends TranslationIssue {

	public static final String CODE = "E_UNSUPPORTED_CONSTRUCT";

	public UnsupportedConstructIssue(JSNode node, String explanation, String suggestion) {
		super(CODE, node, explanation, suggestion);
	}

	public UnsupportedConstructIssue(String nodeKind, SourceLocation location, String explanation,
	                                 String suggestion) {
		super(CODE, nodeKind, location, explanation, suggestion);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
