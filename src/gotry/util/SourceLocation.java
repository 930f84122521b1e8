package gotry.util;

import gotry.Unreachable;
import gotry.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A span of source text. Offsets are 0-based character offsets into the file contents, the end offset being
 * exclusive; lines and columns are 1-based.
 */
public class SourceLocation implements Comparable<SourceLocation> {
	private final Path file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(Path file, int startOffset, int endOffset, int startLine, int endLine, int startColumn,
	                      int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	/**
	 * @return "file:line", the form used when listing positions
	 */
	public String shortString() {
		if (isUnknown()) {
			return "<unknown>";
		}
		return file + ":" + startLine;
	}

	public String prettyString(CharSequence contents) {
		StringWriter sw = new StringWriter();
		try {
			writePretty(new IndentingWriter(sw), contents);
		} catch (IOException e) {
			throw new Unreachable("formatting a location into a string", e);
		}
		return sw.getBuffer().toString();
	}

	/**
	 * Writes the location followed by the offending source line with the span underlined.
	 *
	 * @param contents the contents of the file this location refers to, or null if unavailable
	 */
	public void writePretty(IndentingWriter out, CharSequence contents) throws IOException {
		if (isUnknown()) {
			out.write("at unknown source location");
			return;
		}
		out.write("at ");
		if (startLine != endLine) {
			out.write(startLine + ":" + startColumn + "-" + endLine + ":" + endColumn);
		} else if (startColumn != endColumn) {
			out.write(startLine + ":" + startColumn + "-" + endColumn);
		} else {
			out.write(startLine + ":" + startColumn);
		}
		out.write(" in file " + file);
		if (contents == null || startOffset < 0 || startOffset > contents.length()) {
			return;
		}
		out.newLine();
		int lineStart = startOffset;
		while (lineStart > 0 && contents.charAt(lineStart - 1) != '\n') {
			lineStart--;
		}
		int lineEnd = startOffset;
		while (lineEnd < contents.length() && contents.charAt(lineEnd) != '\n') {
			lineEnd++;
		}
		out.append(contents, lineStart, lineEnd);
		out.newLine();
		for (int pos = lineStart; pos < startOffset; pos++) {
			out.append(contents.charAt(pos) == '\t' ? '\t' : ' ');
		}
		int effectiveEndOffset = Integer.max(Integer.min(endOffset, lineEnd), startOffset + 1);
		for (int pos = startOffset; pos < effectiveEndOffset; pos++) {
			out.append('^');
		}
		if (startOffset == contents.length()) {
			out.append(" EOF");
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	/**
	 * @return the smallest location covering both this location and other
	 */
	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		// combining locations from two files is a programming error; nodes of one module all come from one file
		if (!file.equals(other.getFile())) {
			throw new RuntimeException("Tried to combine source locations from two different files: " + file + ", " + other.getFile());
		}
		int mStartColumn, mEndColumn;
		if (startLine == other.getStartLine()) {
			mStartColumn = Integer.min(startColumn, other.getStartColumn());
		} else if (startLine < other.getStartLine()) {
			mStartColumn = startColumn;
		} else /* startLine > other.getStartLine() */ {
			mStartColumn = other.getStartColumn();
		}
		if (endLine == other.getEndLine()) {
			mEndColumn = Integer.max(endColumn, other.getEndColumn());
		} else if (endLine > other.getEndLine()) {
			mEndColumn = endColumn;
		} else /* endLine < other.getEndLine() */ {
			mEndColumn = other.getEndColumn();
		}
		return new SourceLocation(file,
				Integer.min(startOffset, other.startOffset),
				Integer.max(endOffset, other.endOffset),
				Integer.min(startLine, other.getStartLine()),
				Integer.max(endLine, other.getEndLine()),
				mStartColumn,
				mEndColumn);
	}

	public Path getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	@Override
	public int hashCode() {
		return Objects.hash(file, startOffset, endOffset, startLine, endLine, startColumn, endColumn);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return endColumn == other.endColumn && endLine == other.endLine && startColumn == other.startColumn &&
				startOffset == other.startOffset && endOffset == other.endOffset && startLine == other.startLine &&
				Objects.equals(file, other.file);
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		} else {
			return "SourceLocation [file=" + file + ", startOffset=" + startOffset + ", endOffset=" + endOffset +
					", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
					", endColumn=" + endColumn + "]";
		}
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedFile = getFile().compareTo(o.getFile());
		if (comparedFile != 0) {
			return comparedFile;
		}
		int comparedStartOffset = Integer.compare(getStartOffset(), o.getStartOffset());
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(getEndOffset(), o.getEndOffset());
	}

}
