package gotry.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import gotry.model.golang.GoExpression;

/**
 * Parses expressions and checks that formatting them reproduces the source, parentheses included.
 */
@RunWith(Parameterized.class)
public class GoExpressionParserTest {

	static Path testFile = Paths.get("TEST");

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"a + b * c"},
				{"(a + b) * c"},
				{"!ok && x != nil"},
				{"a << 2 &^ mask"},
				{"f(a, b...)"},
				{"x.y.z"},
				{"a.b(c)[d]"},
				{"m[k]"},
				{"s[1:2]"},
				{"s[:]"},
				{"s[1:2:3]"},
				{"x.(T)"},
				{"x.(*pkg.T)"},
				{"*p"},
				{"&T{A: 1, B: \"b\"}"},
				{"<-ch"},
				{"-1"},
				{"^x"},
				{"[]int{1, 2}"},
				{"map[string][]int{}"},
				{"[][]int{{1}, {2, 3}}"},
				{"struct{}{}"},
				{"pkg.Type{}"},
				{"List[int]{}"},
				{"'a' + 0x1F + 1.5e3 + 2i"},
				{"`raw` + \"cooked\""},
				{"func(x int) int {\n\treturn x\n}"},
				{"func() {\n}()"},
				{"make(chan<- int, 1)"},
				{"new(map[string]func(int) error)"},
		});
	}

	private final String source;

	public GoExpressionParserTest(String source) {
		this.source = source;
	}

	@Test
	public void test() throws GoParseException {
		GoExpression expression = GoParser.readExpression(testFile, source);
		assertThat(expression.toString(), is(source));
	}

}
