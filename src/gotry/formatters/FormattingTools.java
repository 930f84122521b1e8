package gotry.formatters;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

public class FormattingTools {

	private FormattingTools() {}

	public interface Formatter<T> {
		void format(T item) throws IOException;
	}

	/**
	 * Formats each of items in turn, writing separator between consecutive ones
	 */
	public static <T> void writeSeparated(Writer out, List<T> items, String separator, Formatter<T> formatter)
			throws IOException {
		for (int i = 0; i < items.size(); ++i) {
			if (i > 0) {
				out.write(separator);
			}
			formatter.format(items.get(i));
		}
	}

	public static <T> void writeCommaSeparated(Writer out, List<T> items, Formatter<T> formatter) throws IOException {
		writeSeparated(out, items, ", ", formatter);
	}

}
