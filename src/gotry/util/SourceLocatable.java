package gotry.util;

/**
 * Anything traced back to a range of a Go source file: lexer tokens and AST nodes. Statistics and issues report
 * positions through this.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
