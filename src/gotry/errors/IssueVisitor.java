package gotry.errors;

import gotry.trans.output.IOErrorIssue;
import gotry.trans.passes.parse.ParsingIssue;
import gotry.trans.passes.parse.option.OptionParserIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
}
