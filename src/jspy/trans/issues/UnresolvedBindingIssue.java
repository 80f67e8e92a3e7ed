package jspy.trans.issues;

import jspy.errors.IssueVisitor;
import jspy.model.js.JSNode;

/**
 * An identifier that is not declared in any reachable scope and is not a known global.
 */
public class UnresolvedBindingIssue extends TranslationIssue {

	public static final String CODE = "E_UNRESOLVED_BINDING";

	private final String name;

	public UnresolvedBindingIssue(JSNode node, String name) {
		super(CODE, node, "'" + name + "' is not declared in any enclosing scope",
				"declare it with 'var " + name + "' in the enclosing function or at top level");
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
