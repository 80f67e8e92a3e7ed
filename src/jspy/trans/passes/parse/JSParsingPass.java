package jspy.trans.passes.parse;

import jspy.errors.IssueContext;
import jspy.model.js.JSProgram;
import jspy.parser.JSParser;
import jspy.parser.ParsingError;
import jspy.trans.issues.UnsupportedConstructIssue;

import java.nio.file.Path;

public class JSParsingPass {
	private JSParsingPass() {}

	public static JSProgram perform(IssueContext ctx, Path inputFileName, CharSequence inputFileContents) {
		try {
			return JSParser.parse(inputFileName, inputFileContents);
		} catch (ParsingError e) {
			ctx.error(new ParsingIssue(e));
		} catch (UnsupportedConstructIssue e) {
			ctx.error(e);
		}
		return null;
	}
}
