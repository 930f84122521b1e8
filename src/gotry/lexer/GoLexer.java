package gotry.lexer;

import gotry.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Go lexer following the Go language specification, including automatic semicolon insertion.
 *
 * Comments are dropped. A general comment spanning a line break counts as a line break for the purpose of
 * semicolon insertion, as it does for the Go compiler.
 */
public class GoLexer {

	static final String[] KEYWORDS = {
			"break", "case", "chan", "const", "continue", "default", "defer", "else", "fallthrough", "for", "func",
			"go", "goto", "if", "import", "interface", "map", "package", "range", "return", "select", "struct",
			"switch", "type", "var",
	};

	// longest first, so that the first match is the longest
	static final String[] OPERATORS = {
			"<<=", ">>=", "&^=", "...",
			"&&", "||", "<-", "++", "--", "==", "!=", "<=", ">=", ":=", "+=", "-=", "*=", "/=", "%=", "&=", "|=",
			"^=", "<<", ">>", "&^",
			"+", "-", "*", "/", "%", "&", "|", "^", "<", ">", "=", "!", "~", "(", ")", "[", "]", "{", "}", ",", ".",
			":",
	};

	static final Set<String> KEYWORD_SET = new HashSet<>(Arrays.asList(KEYWORDS));

	static final Set<String> SEMICOLON_AFTER = new HashSet<>(Arrays.asList(
			"break", "continue", "fallthrough", "return", "++", "--", ")", "]", "}"));

	static final Pattern IDENT = Pattern.compile("[\\p{L}_][\\p{L}\\p{Nd}_]*");

	private final Path filename;
	private final String contents;
	private final int[] lineStarts;

	public GoLexer(Path filename, String contents) {
		this.filename = filename;
		this.contents = contents;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < contents.length(); i++) {
			if (contents.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	private int lineIndex(int offset) {
		int idx = Arrays.binarySearch(lineStarts, offset);
		return idx >= 0 ? idx : -idx - 2;
	}

	/**
	 * @return the location of the half-open range [start, end) of the contents
	 */
	public SourceLocation location(int start, int end) {
		int startLine = lineIndex(start);
		int endLine = lineIndex(end);
		return new SourceLocation(filename, start, end, startLine + 1, endLine + 1,
				start - lineStarts[startLine] + 1, end - lineStarts[endLine] + 1);
	}

	private GoToken makeToken(String value, GoTokenType type, int start, int end) {
		return new GoToken(value, type, location(start, end));
	}

	private static boolean needsSemicolon(GoToken last) {
		if (last == null) {
			return false;
		}
		switch (last.getType()) {
			case IDENT:
			case INT:
			case FLOAT:
			case IMAG:
			case CHAR:
			case STRING:
				return true;
			case KEYWORD:
			case OPERATOR:
				return SEMICOLON_AFTER.contains(last.getValue());
			default:
				return false;
		}
	}

	/**
	 * @return the tokens of the contents, always ending with a single EOF token
	 * @throws GoLexerException if the contents are not lexically valid Go
	 */
	public List<GoToken> readTokens() throws GoLexerException {
		List<GoToken> tokens = new ArrayList<>();
		GoToken last = null;
		int pos = 0;
		int length = contents.length();
		while (pos < length) {
			char c = contents.charAt(pos);
			if (c == '\n') {
				if (needsSemicolon(last)) {
					last = makeToken("\n", GoTokenType.SEMICOLON, pos, pos + 1);
					tokens.add(last);
				}
				++pos;
				continue;
			}
			if (c == ' ' || c == '\t' || c == '\r' || c == '\uFEFF') {
				++pos;
				continue;
			}
			if (contents.startsWith("//", pos)) {
				int end = contents.indexOf('\n', pos);
				pos = end == -1 ? length : end;
				continue;
			}
			if (contents.startsWith("/*", pos)) {
				int end = contents.indexOf("*/", pos + 2);
				if (end == -1) {
					throw new GoLexerException("comment not terminated", location(pos, pos + 2));
				}
				if (contents.substring(pos, end).indexOf('\n') != -1 && needsSemicolon(last)) {
					last = makeToken("\n", GoTokenType.SEMICOLON, pos, pos + 2);
					tokens.add(last);
				}
				pos = end + 2;
				continue;
			}

			int start = pos;
			GoToken token;
			Matcher m = IDENT.matcher(contents);
			m.region(pos, length);
			if (m.lookingAt()) {
				pos = m.end();
				String word = m.group();
				token = makeToken(word, KEYWORD_SET.contains(word) ? GoTokenType.KEYWORD : GoTokenType.IDENT, start, pos);
			} else if (Character.isDigit(c) || (c == '.' && pos + 1 < length && Character.isDigit(contents.charAt(pos + 1)))) {
				token = readNumber(start);
				pos = token.getLocation().getEndOffset();
			} else if (c == '\'') {
				pos = readQuoted(start, '\'', "rune literal not terminated");
				token = makeToken(contents.substring(start, pos), GoTokenType.CHAR, start, pos);
			} else if (c == '"') {
				pos = readQuoted(start, '"', "string literal not terminated");
				token = makeToken(contents.substring(start, pos), GoTokenType.STRING, start, pos);
			} else if (c == '`') {
				int end = contents.indexOf('`', pos + 1);
				if (end == -1) {
					throw new GoLexerException("raw string literal not terminated", location(start, start + 1));
				}
				pos = end + 1;
				token = makeToken(contents.substring(start, pos), GoTokenType.STRING, start, pos);
			} else if (c == ';') {
				++pos;
				token = makeToken(";", GoTokenType.SEMICOLON, start, pos);
			} else {
				token = null;
				for (String op : OPERATORS) {
					if (contents.startsWith(op, pos)) {
						pos += op.length();
						token = makeToken(op, GoTokenType.OPERATOR, start, pos);
						break;
					}
				}
				if (token == null) {
					throw new GoLexerException("invalid character " + describeChar(c), location(start, start + 1));
				}
			}
			tokens.add(token);
			last = token;
		}
		if (needsSemicolon(last)) {
			tokens.add(makeToken("", GoTokenType.SEMICOLON, length, length));
		}
		tokens.add(makeToken("", GoTokenType.EOF, length, length));
		return tokens;
	}

	private static String describeChar(char c) {
		if (Character.isISOControl(c)) {
			return String.format("U+%04X", (int) c);
		}
		return "'" + c + "'";
	}

	/**
	 * @return the offset just past the closing quote
	 */
	private int readQuoted(int start, char quote, String unterminated) throws GoLexerException {
		int pos = start + 1;
		while (pos < contents.length()) {
			char c = contents.charAt(pos);
			if (c == '\n') {
				break;
			}
			if (c == '\\') {
				pos += 2;
				continue;
			}
			if (c == quote) {
				return pos + 1;
			}
			++pos;
		}
		throw new GoLexerException(unterminated, location(start, Integer.min(pos, contents.length())));
	}

	private static boolean isHexDigit(char c) {
		return Character.digit(c, 16) != -1;
	}

	private int skip(int pos, boolean hex) {
		while (pos < contents.length()) {
			char c = contents.charAt(pos);
			if (c == '_' || (hex ? isHexDigit(c) : Character.isDigit(c))) {
				++pos;
			} else {
				break;
			}
		}
		return pos;
	}

	private int skipExponent(int pos) {
		++pos;
		if (pos < contents.length() && (contents.charAt(pos) == '+' || contents.charAt(pos) == '-')) {
			++pos;
		}
		return skip(pos, false);
	}

	private char charAt(int pos) {
		return pos < contents.length() ? contents.charAt(pos) : '\0';
	}

	private GoToken readNumber(int start) {
		int pos = start;
		boolean isFloat = false;
		char next = Character.toLowerCase(charAt(start + 1));
		if (charAt(start) == '0' && next == 'x') {
			pos = skip(start + 2, true);
			if (charAt(pos) == '.') {
				isFloat = true;
				pos = skip(pos + 1, true);
			}
			if (Character.toLowerCase(charAt(pos)) == 'p') {
				isFloat = true;
				pos = skipExponent(pos);
			}
		} else if (charAt(start) == '0' && (next == 'b' || next == 'o')) {
			// digits are validated when the literal's value is needed
			pos = skip(start + 2, false);
		} else {
			pos = skip(start, false);
			if (charAt(pos) == '.') {
				isFloat = true;
				pos = skip(pos + 1, false);
			}
			if (Character.toLowerCase(charAt(pos)) == 'e') {
				isFloat = true;
				pos = skipExponent(pos);
			}
		}
		GoTokenType type = isFloat ? GoTokenType.FLOAT : GoTokenType.INT;
		if (charAt(pos) == 'i') {
			++pos;
			type = GoTokenType.IMAG;
		}
		return makeToken(contents.substring(start, pos), type, start, pos);
	}

}
