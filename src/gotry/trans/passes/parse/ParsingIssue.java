package gotry.trans.passes.parse;

import gotry.errors.Issue;
import gotry.errors.IssueVisitor;
import gotry.parser.GoParseException;

public class ParsingIssue extends Issue {
	private final GoParseException error;
	private final CharSequence contents;

	/**
	 * @param contents the text that failed to parse, used to quote the offending line
	 */
	public ParsingIssue(GoParseException error, CharSequence contents) {
		initCause(error);
		this.error = error;
		this.contents = contents;
	}

	public GoParseException getError() {
		return error;
	}

	public CharSequence getContents() {
		return contents;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
