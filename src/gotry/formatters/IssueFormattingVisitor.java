package gotry.formatters;

import gotry.errors.IssueVisitor;
import gotry.trans.output.IOErrorIssue;
import gotry.trans.passes.parse.ParsingIssue;
import gotry.trans.passes.parse.option.OptionParserIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getMessage());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error");
		if (ioErrorIssue.getPath() != null) {
			out.write(" in ");
			out.write(ioErrorIssue.getPath().toString());
		}
		out.write(": ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing Go: ");
		out.write(parsingIssue.getError().getMsg());
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			parsingIssue.getError().getLocation().writePretty(out, parsingIssue.getContents());
		}
		return null;
	}
}
