package gotry.lexer;

public enum GoTokenType {
	IDENT,
	KEYWORD,
	INT,
	FLOAT,
	IMAG,
	CHAR,
	STRING,
	// punctuation and operators
	OPERATOR,
	// explicit, or inserted at a line break or the end of the file
	SEMICOLON,
	EOF,
}
