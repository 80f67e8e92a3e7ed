package jspy.errors;

import jspy.Unreachable;
import jspy.formatters.IndentingWriter;
import jspy.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the issues of one run of the command line driver: option and IO problems, and the first issue of the
 * translated unit.
 */
public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue err) {
		issues.add(err);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	/**
	 * Writes a "Detected N issue(s):" header followed by each issue, indented one level.
	 */
	public void format(IndentingWriter out) throws IOException {
		out.write("Detected " + issues.size() + " issue(s):");
		IssueFormattingVisitor formatter = new IssueFormattingVisitor(out);
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Issue issue : issues) {
				out.newLine();
				issue.accept(formatter);
			}
		}
	}

	public String format() {
		StringWriter writer = new StringWriter();
		try {
			format(new IndentingWriter(writer));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return writer.toString();
	}
}
