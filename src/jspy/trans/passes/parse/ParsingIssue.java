package jspy.trans.passes.parse;

import jspy.errors.Issue;
import jspy.errors.IssueVisitor;
import jspy.parser.ParsingError;
import jspy.util.SourceLocation;

/**
 * Wraps a syntax error from the JavaScript front end so it can travel through an {@link jspy.errors.IssueContext}.
 */
public class ParsingIssue extends Issue {
	private final ParsingError error;

	public ParsingIssue(ParsingError error) {
		initCause(error);
		this.error = error;
	}

	public String getReason() {
		return error.getReason();
	}

	public SourceLocation getLocation() {
		return error.getLocation();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
