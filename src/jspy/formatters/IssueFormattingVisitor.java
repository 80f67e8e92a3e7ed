package jspy.formatters;

import jspy.errors.IssueVisitor;
import jspy.trans.IOErrorIssue;
import jspy.trans.issues.AmbiguousEvaluationContextIssue;
import jspy.trans.issues.AmbiguousFallThroughIssue;
import jspy.trans.issues.ContinueInsideDispatchIssue;
import jspy.trans.issues.JumpOutsideTargetIssue;
import jspy.trans.issues.TranslationIssue;
import jspy.trans.issues.UnresolvedBindingIssue;
import jspy.trans.issues.UnsupportedConstructIssue;
import jspy.trans.passes.parse.ParsingIssue;
import jspy.trans.passes.parse.option.OptionParserIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	private void writeTranslationIssue(String category, TranslationIssue issue) throws IOException {
		out.write(category);
		out.write(" [");
		out.write(issue.getCode());
		out.write("]: ");
		out.write(issue.getExplanation());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			out.write(issue.getNodeKind());
			out.write(" ");
			issue.getLocation().writePretty(out);
			if (issue.getSuggestion() != null) {
				out.newLine();
				out.write("suggestion: ");
				out.write(issue.getSuggestion());
			}
		}
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getReason());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("syntax error: ");
		out.write(parsingIssue.getReason());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			parsingIssue.getLocation().writePretty(out);
		}
		return null;
	}

	@Override
	public Void visit(UnsupportedConstructIssue unsupportedConstructIssue) throws IOException {
		writeTranslationIssue("unsupported construct", unsupportedConstructIssue);
		return null;
	}

	@Override
	public Void visit(JumpOutsideTargetIssue jumpOutsideTargetIssue) throws IOException {
		writeTranslationIssue("jump outside target", jumpOutsideTargetIssue);
		return null;
	}

	@Override
	public Void visit(ContinueInsideDispatchIssue continueInsideDispatchIssue) throws IOException {
		writeTranslationIssue("continue inside switch", continueInsideDispatchIssue);
		return null;
	}

	@Override
	public Void visit(AmbiguousFallThroughIssue ambiguousFallThroughIssue) throws IOException {
		writeTranslationIssue("ambiguous fall-through", ambiguousFallThroughIssue);
		return null;
	}

	@Override
	public Void visit(UnresolvedBindingIssue unresolvedBindingIssue) throws IOException {
		writeTranslationIssue("unresolved binding", unresolvedBindingIssue);
		return null;
	}

	@Override
	public Void visit(AmbiguousEvaluationContextIssue ambiguousEvaluationContextIssue) throws IOException {
		writeTranslationIssue("ambiguous evaluation context", ambiguousEvaluationContextIssue);
		return null;
	}
}
