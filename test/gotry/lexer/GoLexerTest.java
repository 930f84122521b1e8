package gotry.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class GoLexerTest {

	static Path testFile = Paths.get("TEST");

	private static String tok(GoTokenType type, String value) {
		return type + ":" + value;
	}

	private static String ident(String value) {
		return tok(GoTokenType.IDENT, value);
	}

	private static String op(String value) {
		return tok(GoTokenType.OPERATOR, value);
	}

	private static String newline() {
		return tok(GoTokenType.SEMICOLON, "\n");
	}

	private static String eofSemicolon() {
		return tok(GoTokenType.SEMICOLON, "");
	}

	private static String eof() {
		return tok(GoTokenType.EOF, "");
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"", Arrays.asList(eof())},
				{"a", Arrays.asList(ident("a"), eofSemicolon(), eof())},
				{"x := 1\ny++\n", Arrays.asList(
						ident("x"), op(":="), tok(GoTokenType.INT, "1"), newline(),
						ident("y"), op("++"), newline(),
						eof())
				},
				{"return\n}", Arrays.asList(
						tok(GoTokenType.KEYWORD, "return"), newline(), op("}"), eofSemicolon(), eof())
				},
				// no semicolon after an operator that cannot end a statement
				{"f(\n)", Arrays.asList(ident("f"), op("("), op(")"), eofSemicolon(), eof())},
				{"a + // trailing\nb", Arrays.asList(ident("a"), op("+"), ident("b"), eofSemicolon(), eof())},
				{"a /* one\n two */ b", Arrays.asList(ident("a"), newline(), ident("b"), eofSemicolon(), eof())},
				{"a /* one line */ b", Arrays.asList(ident("a"), ident("b"), eofSemicolon(), eof())},
				{"0x1p-2 1_000 07 1.5e3 .5 2i 0b101 0o17", Arrays.asList(
						tok(GoTokenType.FLOAT, "0x1p-2"),
						tok(GoTokenType.INT, "1_000"),
						tok(GoTokenType.INT, "07"),
						tok(GoTokenType.FLOAT, "1.5e3"),
						tok(GoTokenType.FLOAT, ".5"),
						tok(GoTokenType.IMAG, "2i"),
						tok(GoTokenType.INT, "0b101"),
						tok(GoTokenType.INT, "0o17"),
						eofSemicolon(), eof())
				},
				{"'\\n' \"a\\\"b\" `raw\nstring`", Arrays.asList(
						tok(GoTokenType.CHAR, "'\\n'"),
						tok(GoTokenType.STRING, "\"a\\\"b\""),
						tok(GoTokenType.STRING, "`raw\nstring`"),
						eofSemicolon(), eof())
				},
				{"a &^= b <- c...", Arrays.asList(
						ident("a"), op("&^="), ident("b"), op("<-"), ident("c"), op("..."), eof())
				},
				{"if x { ; }", Arrays.asList(
						tok(GoTokenType.KEYWORD, "if"), ident("x"), op("{"),
						tok(GoTokenType.SEMICOLON, ";"), op("}"), eofSemicolon(), eof())
				},
				{"héllo", Arrays.asList(ident("héllo"), eofSemicolon(), eof())},
		});
	}

	private final String source;
	private final List<String> expected;

	public GoLexerTest(String source, List<String> expected) {
		this.source = source;
		this.expected = expected;
	}

	@Test
	public void test() throws GoLexerException {
		List<GoToken> tokens = new GoLexer(testFile, source).readTokens();
		List<String> actual = tokens.stream()
				.map(t -> tok(t.getType(), t.getValue()))
				.collect(Collectors.toList());
		assertThat(actual, is(expected));
	}

}
