package jspy.util;

import jspy.Unreachable;
import jspy.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of a source file. Lines and columns are 0-based; {@link #writePretty(IndentingWriter)} prints them 1-based,
 * followed by the first line of the span with a caret underline.
 * End columns print inclusive, so a one-character span prints only its start.
 */
public final class SourceLocation {
	private static final SourceLocation UNKNOWN = new SourceLocation(null, -1, -1, -1, -1, null);

	private final Path file;
	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;
	// the full text of startLine, without its line feed
	private final String lineText;

	private SourceLocation(Path file, int startLine, int startColumn, int endLine, int endColumn, String lineText) {
		this.file = file;
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.lineText = lineText;
	}

	/**
	 * Builds a location from character offsets into the source text. Offsets outside the text are clamped to it.
	 */
	public static SourceLocation fromOffsets(Path file, CharSequence source, int startOffset, int endOffset) {
		int start = Math.max(0, Math.min(startOffset, source.length()));
		int end = Math.max(start, Math.min(endOffset, source.length()));

		int line = 0;
		int lineStart = 0;
		int startLine = 0;
		int startLineStart = 0;
		for (int pos = 0; pos < end; pos++) {
			if (pos == start) {
				startLine = line;
				startLineStart = lineStart;
			}
			if (source.charAt(pos) == '\n') {
				line++;
				lineStart = pos + 1;
			}
		}
		if (start == end) {
			startLine = line;
			startLineStart = lineStart;
		}

		int startLineEnd = startLineStart;
		while (startLineEnd < source.length() && source.charAt(startLineEnd) != '\n') {
			startLineEnd++;
		}
		String lineText = source.subSequence(startLineStart, startLineEnd).toString();
		return new SourceLocation(file, startLine, start - startLineStart, line, end - lineStart, lineText);
	}

	public static SourceLocation unknown() {
		return UNKNOWN;
	}

	public boolean isUnknown() {
		return file == null;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		try {
			writePretty(new IndentingWriter(sw));
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return sw.toString();
	}

	public void writePretty(IndentingWriter out) throws IOException {
		if (isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at " + (startLine + 1) + ":" + (startColumn + 1));
		if (endLine != startLine) {
			out.write("-" + (endLine + 1) + ":" + endColumn);
		} else if (endColumn > startColumn + 1) {
			out.write("-" + endColumn);
		}
		out.write(" in file " + file);

		out.newLine();
		out.write(lineText);
		out.newLine();
		StringBuilder marker = new StringBuilder();
		for (int i = 0; i < startColumn; i++) {
			// keep tabs so the caret lines up under the source
			marker.append(lineText.charAt(i) == '\t' ? '\t' : ' ');
		}
		int caretEnd = endLine == startLine ? Math.max(endColumn, startColumn + 1) : lineText.length();
		for (int i = startColumn; i < Math.max(caretEnd, startColumn + 1); i++) {
			marker.append('^');
		}
		out.write(marker.toString());
	}

	public Path getFile() {
		return file;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SourceLocation)) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startLine == other.startLine && startColumn == other.startColumn && endLine == other.endLine &&
				endColumn == other.endColumn && Objects.equals(file, other.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startLine, startColumn, endLine, endColumn);
	}

	@Override
	public String toString() {
		return isUnknown() ? "SourceLocation [unknown]"
				: "SourceLocation [" + file + ":" + (startLine + 1) + ":" + (startColumn + 1) + "]";
	}
}
