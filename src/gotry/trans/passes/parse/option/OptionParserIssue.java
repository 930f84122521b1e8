package gotry.trans.passes.parse.option;

import gotry.errors.Issue;
import gotry.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	@Override
	public String getMessage() {
		return message;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
