package gotry.trans.passes.trycheck;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import gotry.parser.GoParseException;

@RunWith(Parameterized.class)
public class GoExpressionStructuralEqualityVisitorTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][]{
				{"err", "err", true},
				{"err", "e", false},
				{"wrap(err)", "wrap(err)", true},
				{"wrap(err)", "wrap( err )", true},
				{"wrap(err)", "wrap(err, 1)", false},
				{"wrap(err)", "other(err)", false},
				{"fmt.Errorf(\"x: %v\", err)", "fmt.Errorf(\"x: %v\", err)", true},
				{"fmt.Errorf(\"x: %v\", err)", "fmt.Errorf(\"y: %v\", err)", false},
				{"f(xs...)", "f(xs...)", true},
				{"f(xs...)", "f(xs)", false},
				{"a + b", "a + b", true},
				{"a + b", "a - b", false},
				{"a + b", "(a + b)", false},
				{"-x", "-x", true},
				{"*p", "&p", false},
				{"16", "16", true},
				{"16", "0x10", false},
				{"1.5", "1.5", true},
				{"'a'", "'a'", true},
				{"a[i]", "a[i]", true},
				{"a[i:j]", "a[i:j]", true},
				{"a[i:j]", "a[i:]", false},
				{"x.(T)", "x.(T)", true},
				{"x.(T)", "x.(U)", false},
				{"T{a: 1}", "T{a: 1}", true},
				{"T{a: 1}", "T{a: 2}", false},
				{"[]int{1, 2}", "[]int{1, 2}", true},
				{"map[string]*T{}", "map[string]*T{}", true},
				{"map[string]*T{}", "map[string]T{}", false},
				{"struct{ a int }{}", "struct{ a int }{}", true},
				{"struct{ a int }{}", "struct{ b int }{}", false},
				{"func() {}", "func() {}", false},
				{"err", "f()", false},
		});
	}

	private final String lhs;
	private final String rhs;
	private final boolean expected;

	public GoExpressionStructuralEqualityVisitorTest(String lhs, String rhs, boolean expected) {
		this.lhs = lhs;
		this.rhs = rhs;
		this.expected = expected;
	}

	@Test
	public void test() throws GoParseException {
		assertThat(GoExpressionStructuralEqualityVisitor.equal(
				TryCheckTestingUtils.expr(lhs), TryCheckTestingUtils.expr(rhs)), is(expected));
	}

	@Test
	public void symmetric() throws GoParseException {
		assertThat(GoExpressionStructuralEqualityVisitor.equal(
				TryCheckTestingUtils.expr(rhs), TryCheckTestingUtils.expr(lhs)), is(expected));
	}

}
