package gotry.lexer;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.junit.Test;

import gotry.util.SourceLocation;

public class GoLexerLocationTest {

	static Path testFile = Paths.get("TEST");

	@Test
	public void tokensCarryOffsetsLinesAndColumns() throws GoLexerException {
		List<GoToken> tokens = new GoLexer(testFile, "a\n  bc").readTokens();
		GoToken bc = tokens.get(2);
		assertThat(bc.getValue(), is("bc"));
		assertThat(bc.getLocation(), is(new SourceLocation(testFile, 4, 6, 2, 2, 3, 5)));
	}

	@Test
	public void unterminatedString() {
		try {
			new GoLexer(testFile, "x := \"abc\ny").readTokens();
			fail("expected a lexer error");
		} catch (GoLexerException e) {
			assertThat(e.getLocation().getStartLine(), is(1));
			assertThat(e.getLocation().getStartColumn(), is(6));
		}
	}

	@Test
	public void unterminatedComment() {
		try {
			new GoLexer(testFile, "x /* never closed").readTokens();
			fail("expected a lexer error");
		} catch (GoLexerException e) {
			assertThat(e.getMessage(), containsString("comment not terminated"));
		}
	}

	@Test
	public void invalidCharacter() {
		try {
			new GoLexer(testFile, "a # b").readTokens();
			fail("expected a lexer error");
		} catch (GoLexerException e) {
			assertThat(e.getMessage(), containsString("'#'"));
		}
	}

}
