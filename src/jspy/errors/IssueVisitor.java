package jspy.errors;

import jspy.trans.IOErrorIssue;
import jspy.trans.issues.AmbiguousEvaluationContextIssue;
import jspy.trans.issues.AmbiguousFallThroughIssue;
import jspy.trans.issues.ContinueInsideDispatchIssue;
import jspy.trans.issues.JumpOutsideTargetIssue;
import jspy.trans.issues.UnresolvedBindingIssue;
import jspy.trans.issues.UnsupportedConstructIssue;
import jspy.trans.passes.parse.ParsingIssue;
import jspy.trans.passes.parse.option.OptionParserIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(UnsupportedConstructIssue unsupportedConstructIssue) throws E;
	public abstract T visit(JumpOutsideTargetIssue jumpOutsideTargetIssue) throws E;
	public abstract T visit(ContinueInsideDispatchIssue continueInsideDispatchIssue) throws E;
	public abstract T visit(AmbiguousFallThroughIssue ambiguousFallThroughIssue) throws E;
	public abstract T visit(UnresolvedBindingIssue unresolvedBindingIssue) throws E;
	public abstract T visit(AmbiguousEvaluationContextIssue ambiguousEvaluationContextIssue) throws E;
}
