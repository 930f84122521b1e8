package gotry.errors;

import java.io.IOException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import gotry.Unreachable;
import gotry.formatters.IndentingWriter;
import gotry.formatters.IssueFormattingVisitor;

public class TopLevelIssueContext extends IssueContext {

	private final List<Issue> issues = new ArrayList<>();

	@Override
	public void error(Issue issue) {
		issues.add(issue);
	}

	@Override
	public boolean hasErrors() {
		return !issues.isEmpty();
	}

	/**
	 * @return the issues in the order they were reported
	 */
	public List<Issue> getIssues() {
		return Collections.unmodifiableList(issues);
	}

	public void format(IndentingWriter out) throws IOException {
		out.write("gotry: ");
		out.write(Integer.toString(issues.size()));
		out.write(issues.size() == 1 ? " issue:" : " issues:");
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (Issue issue : issues) {
				out.newLine();
				issue.accept(new IssueFormattingVisitor(out));
			}
		}
	}

	public String format() {
		StringWriter w = new StringWriter();
		try {
			format(new IndentingWriter(w));
		} catch (IOException e) {
			throw new Unreachable("formatting issues into a string", e);
		}
		return w.toString();
	}
}
