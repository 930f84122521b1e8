package gotry.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that prefixes every line with the current indentation. Go source is always written with "\n" line
 * endings and, by default, one tab per indentation level.
 */
public class IndentingWriter extends Writer {

	private static final String LF = "\n";

	private final Writer out;
	private final String indentUnit;
	private int indent = 0;
	private boolean shouldIndent = false;
	private int horizontalPosition = 0;
	
	public static class Indent implements AutoCloseable {
		
		private final IndentingWriter writer;
		private final int levels;

		public Indent(IndentingWriter writer, int levels) {
			this.writer = writer;
			this.levels = levels;
		}

		@Override
		public void close() {
			writer.unindent(levels);
		}

	}
	
	public Indent indent(int levels) {
		indent += levels;
		return new Indent(this, levels);
	}
	
	public Indent indent() {
		return indent(1);
	}
	
	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return horizontalPosition;
	}
	
	public void unindent(int levels) {
		if(levels > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= levels;
	}
	
	public IndentingWriter(Writer out) {
		this(out, "\t");
	}
	
	public IndentingWriter(Writer out, String indentUnit) {
		this.out = out;
		this.indentUnit = indentUnit;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}
	
	public void newLine() throws IOException {
		write(LF);
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while(start < data.length()) {
			// blank lines stay empty
			if(shouldIndent && !data.startsWith(LF, start)) {
				for(int i = 0; i < indent; ++i) {
					out.write(indentUnit);
				}
				shouldIndent = false;
				horizontalPosition = indent * indentUnit.length();
			}
			int next = data.indexOf(LF, start);
			if(next != -1) {
				out.write(data, start, next + LF.length() - start);
				start = next + LF.length();
				horizontalPosition = 0;
				shouldIndent = true;
			}else {
				horizontalPosition += data.length() - start;
				out.write(data.substring(start));
				break;
			}
		}
	}

}
