package jspy.trans.issues;

import jspy.errors.Issue;
import jspy.model.js.JSNode;
import jspy.util.SourceLocation;

/**
 * Base of every error the structural analysis and code generation passes can raise. Each one names the offending
 * node kind and position, says what went wrong and what to write instead, and carries a stable code.
 */
public abstract class TranslationIssue extends Issue {

	private final String code;
	private final String nodeKind;
	private final SourceLocation location;
	private final String explanation;
	private final String suggestion;

	protected TranslationIssue(String code, JSNode node, String explanation, String suggestion) {
		this(code, node.getKind(), node.getLocation(), explanation, suggestion);
	}

	protected TranslationIssue(String code, String nodeKind, SourceLocation location, String explanation,
	                           String suggestion) {
		this.code = code;
		this.nodeKind = nodeKind;
		this.location = location;
		this.explanation = explanation;
		this.suggestion = suggestion;
	}

	public String getCode() {
		return code;
	}

	public String getNodeKind() {
		return nodeKind;
	}

	public SourceLocation getLocation() {
		return location;
	}

	public String getExplanation() {
		return explanation;
	}

	public String getSuggestion() {
		return suggestion;
	}
}
