package gotry.errors;

import gotry.GoTryException;
import gotry.Unreachable;
import gotry.formatters.IndentingWriter;
import gotry.formatters.IssueFormattingVisitor;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends GoTryException {
	public Issue() {
		super("Issue", "");
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable("formatting an issue into a string", e);
		}
		return sw.getBuffer().toString();
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;
	
}
