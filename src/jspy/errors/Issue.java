package jspy.errors;

import jspy.Unreachable;
import jspy.formatters.IndentingWriter;
import jspy.formatters.IssueFormattingVisitor;
import jspy.trans.JSPyTransException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends JSPyTransException {
	public Issue() {
		super("");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(e); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
