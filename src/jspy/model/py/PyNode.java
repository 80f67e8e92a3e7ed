package jspy.model.py;

import jspy.formatters.IndentingWriter;
import jspy.formatters.PyNodeFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class PyNode {

	public abstract <T, E extends Throwable> T accept(PyNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new PyNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new RuntimeException("StringWriter should not throw IOException", e);
		}
		return w.toString();
	}

}
