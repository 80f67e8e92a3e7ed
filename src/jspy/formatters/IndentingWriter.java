package jspy.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * Writer that prefixes every non-empty line with the current indentation, four spaces per level. Lines always end
 * with a bare line feed; Python reads the indentation as block structure, so blank lines carry none.
 */
public class IndentingWriter extends Writer {

	private static final char LF = '\n';
	private static final String LEVEL = "    ";

	private final Writer out;
	private int depth = 0;
	private boolean atLineStart = false;

	/**
	 * Closing an Indent returns the writer to the level it had before {@link #indent()}.
	 */
	public static final class Indent implements AutoCloseable {
		private final IndentingWriter writer;

		private Indent(IndentingWriter writer) {
			this.writer = writer;
		}

		@Override
		public void close() {
			writer.depth--;
		}
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public Indent indent() {
		depth++;
		return new Indent(this);
	}

	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		int end = offset + len;
		int lineStart = offset;
		for (int i = offset; i < end; i++) {
			if (chars[i] != LF) {
				continue;
			}
			writeLine(chars, lineStart, i + 1 - lineStart);
			atLineStart = true;
			lineStart = i + 1;
		}
		if (lineStart < end) {
			writeLine(chars, lineStart, end - lineStart);
		}
	}

	private void writeLine(char[] chars, int offset, int len) throws IOException {
		if (atLineStart && chars[offset] != LF) {
			for (int i = 0; i < depth; i++) {
				out.write(LEVEL);
			}
		}
		atLineStart = false;
		out.write(chars, offset, len);
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	@Override
	public void close() throws IOException {
		out.close();
	}
}
