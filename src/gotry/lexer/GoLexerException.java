package gotry.lexer;

import gotry.parser.GoParseException;
import gotry.util.SourceLocation;

public class GoLexerException extends GoParseException {

	public GoLexerException(String msg, SourceLocation location) {
		super("Go lexer error", msg, location);
	}

}
