package gotry.trans.passes.trycheck;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gotry.model.golang.GoIf;
import gotry.model.golang.GoModule;
import gotry.model.golang.GoStatement;
import gotry.parser.GoParseException;
import gotry.stats.StatKind;
import gotry.stats.Stats;
import gotry.util.SourceLocation;

public class TryCandidatePassTest {

	static final TryCandidateOptions REWRITE = new TryCandidateOptions(true);
	static final TryCandidateOptions LIST = new TryCandidateOptions(false);

	private static List<String> strings(List<GoStatement> statements) {
		List<String> out = new ArrayList<>();
		for (GoStatement statement : statements) {
			out.add(statement.toString());
		}
		return out;
	}

	private static List<String> lines(List<SourceLocation> positions) {
		List<String> out = new ArrayList<>();
		for (SourceLocation position : positions) {
			out.add(position.shortString());
		}
		return out;
	}

	@Test
	public void separateFormIsCollapsed() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"var v int",
				"v, err = g()",
				"if err != nil {",
				"	return 0, err",
				"}",
				"return v, nil");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(true));

		List<GoStatement> body = TryCheckTestingUtils.body(module);
		assertThat(body.size(), is(3));
		assertThat(body.get(1).toString(), is("v = try(g())"));
		assertThat(stats.getCount(StatKind.FUNC), is(1));
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(1));
		assertThat(stats.getCount(StatKind.STMT), is(5));
		assertThat(stats.getCount(StatKind.IF), is(1));
		assertThat(stats.getCount(StatKind.IF_ERR), is(1));
		assertThat(stats.getCount(StatKind.NON_ERR_NAME), is(0));
		assertThat(lines(stats.getPositions(StatKind.TRY_CANDIDATE)), hasItems("test.go:5"));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(1));
	}

	@Test
	public void initializerFormKeepsTheIf() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (*T, error)",
				"if v, e := g(); e != nil {",
				"	return nil, e",
				"} else {",
				"	use(v)",
				"}",
				"if v, e := g(); e != nil {",
				"	return nil, e",
				"}",
				"return nil, nil");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, new TryCandidateOptions("", "error", true), stats), is(true));

		List<GoStatement> body = TryCheckTestingUtils.body(module);
		assertThat(body.size(), is(3));
		GoIf rewritten = (GoIf) body.get(1);
		assertThat(rewritten.getInit().toString(), is("v := try(g())"));
		assertThat(rewritten.getCond().toString(), is("e != nil"));
		assertThat(((GoIf) body.get(0)).getInit().toString(), is("v, e := g()"));

		assertThat(stats.getCount(StatKind.NON_ERR_NAME), is(2));
		assertThat(lines(stats.getPositions(StatKind.HAS_ELSE)), hasItems("test.go:4"));
		assertThat(lines(stats.getPositions(StatKind.TRY_CANDIDATE)), hasItems("test.go:9"));
	}

	@Test
	public void listModeLeavesTheTreeAlone() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() error",
				"err := g()",
				"if err != nil {",
				"	return err",
				"}",
				"return nil");
		String before = module.toString();
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, LIST, stats), is(false));
		assertThat(module.toString(), is(before));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(1));
	}

	@Test
	public void blankTargetsBecomeAnExpressionStatement() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() error",
				"_, _, err = g()",
				"if err != nil {",
				"	return err",
				"}",
				"err = h()",
				"if err != nil {",
				"	return",
				"}",
				"return nil");
		TryCandidatePass.perform(module, REWRITE, new Stats());
		assertThat(strings(TryCheckTestingUtils.body(module)), is(java.util.Arrays.asList(
				"try(g())",
				"try(h())",
				"return nil")));
	}

	@Test
	public void rewritingIsIdempotent() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"v, err := g()",
				"if err != nil {",
				"	return 0, err",
				"}",
				"return v, nil");
		assertThat(TryCandidatePass.perform(module, REWRITE, new Stats()), is(true));
		String once = module.toString();

		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(false));
		assertThat(module.toString(), is(once));
		assertThat(stats.getCount(StatKind.IF), is(0));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(0));
	}

	@Test
	public void sharedReturnExpressions() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"v, err := g()",
				"if err != nil {",
				"	return 0, wrap(err)",
				"}",
				"err = h()",
				"if err != nil {",
				"	return 0, wrap(err)",
				"}",
				"return v, nil");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(false));
		assertThat(lines(stats.getPositions(StatKind.RETURN_EXPR)), is(java.util.Arrays.asList(
				"test.go:5", "test.go:9")));
		assertThat(lines(stats.getPositions(StatKind.SHARED_RETURN)), is(java.util.Arrays.asList(
				"test.go:6", "test.go:10")));
	}

	@Test
	public void differingReturnExpressionsAreNotShared() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"v, err := g()",
				"if err != nil {",
				"	return 0, wrap(err)",
				"}",
				"err = h()",
				"if err != nil {",
				"	return 0, wrap(err, 1)",
				"}",
				"return v, nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.RETURN_EXPR), is(2));
		assertThat(stats.getCount(StatKind.SHARED_RETURN), is(0));
	}

	@Test
	public void candidateInvalidatesSharedReturns() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"v, err := g()",
				"if err != nil {",
				"	return 0, wrap(err)",
				"}",
				"err = h()",
				"if err != nil {",
				"	return 0, err",
				"}",
				"err = k()",
				"if err != nil {",
				"	return 0, wrap(err)",
				"}",
				"return v, nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(1));
		assertThat(stats.getCount(StatKind.SHARED_RETURN), is(0));
	}

	@Test
	public void sharedReturnsAreTrackedPerFunction() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() error",
				"err := g()",
				"if err != nil {",
				"	return wrap(err)",
				"}",
				"return nil",
				"}",
				"",
				"func h() error {",
				"	err := g()",
				"	if err != nil {",
				"		return wrap(err)",
				"	}",
				"	return nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(2));
		assertThat(stats.getCount(StatKind.RETURN_EXPR), is(2));
		assertThat(stats.getCount(StatKind.SHARED_RETURN), is(0));
	}

	@Test
	public void functionsNotReturningAnErrorAreNotExamined() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (error, int)",
				"err := g()",
				"if err != nil {",
				"	return err, 0",
				"}",
				"return nil, 0");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(false));
		assertThat(stats.getCount(StatKind.FUNC), is(1));
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(0));
		assertThat(stats.getCount(StatKind.STMT), is(0));
		assertThat(stats.getCount(StatKind.IF), is(0));
	}

	@Test
	public void qualifiedErrorTypeDoesNotCount() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() pkg.error",
				"return nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(0));
	}

	@Test
	public void customErrorType() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, myError)",
				"v, err := g()",
				"if err != nil {",
				"	return 0, err",
				"}",
				"return v, nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, new TryCandidateOptions("err", "myError", false), stats);
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(1));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(1));

		Stats defaults = new Stats();
		TryCandidatePass.perform(module, LIST, defaults);
		assertThat(defaults.getCount(StatKind.FUNC_ERROR), is(0));
	}

	@Test
	public void functionWithoutBody() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() error",
				"return nil",
				"}",
				"",
				"func external() error",
				"",
				"func g() {");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.FUNC), is(3));
		assertThat(stats.getCount(StatKind.FUNC_ERROR), is(1));
	}

	@Test
	public void nestedBlocksAreWalked() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f(xs []int) error",
				"for _, x := range xs {",
				"	switch x {",
				"	case 1:",
				"		err := g()",
				"		if err != nil {",
				"			return err",
				"		}",
				"	}",
				"}",
				"for {",
				"	{",
				"		if err := g(); err != nil {",
				"			return err",
				"		}",
				"	}",
				"}");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(true));
		assertThat(lines(stats.getPositions(StatKind.TRY_CANDIDATE)), is(java.util.Arrays.asList(
				"test.go:7", "test.go:15")));
		assertThat(module.toString(), containsString("\t\t\ttry(g())\n"));
		assertThat(module.toString(), containsString("if try(g()); err != nil {"));
	}

	@Test
	public void functionLiteralsAreNotExamined() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() error",
				"h := func() error {",
				"	err := g()",
				"	if err != nil {",
				"		return err",
				"	}",
				"	return nil",
				"}",
				"return h()");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(false));
		assertThat(stats.getCount(StatKind.STMT), is(2));
		assertThat(stats.getCount(StatKind.IF), is(0));
	}

	@Test
	public void labeledStatementsAndElseIfAreNotDescended() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f(ok bool) error",
				"L:",
				"for {",
				"	err := g()",
				"	if err != nil {",
				"		return err",
				"	}",
				"	break L",
				"}",
				"if ok {",
				"	return nil",
				"} else if err := g(); err != nil {",
				"	return err",
				"}",
				"return nil");
		Stats stats = new Stats();
		assertThat(TryCandidatePass.perform(module, REWRITE, stats), is(false));
		assertThat(stats.getCount(StatKind.IF), is(1));
		assertThat(stats.getCount(StatKind.IF_ERR), is(0));
	}

	@Test
	public void reasonBuckets() throws GoParseException {
		GoModule module = TryCheckTestingUtils.function("f() (int, error)",
				"err := g()",
				"if err != nil {",
				"	panic(err)",
				"}",
				"if err != nil {",
				"	log(err)",
				"	return 0, err",
				"}",
				"if err != nil {",
				"	return 1, err",
				"}",
				"if err == nil {",
				"	return 0, nil",
				"}",
				"return 0, nil");
		Stats stats = new Stats();
		TryCandidatePass.perform(module, LIST, stats);
		assertThat(stats.getCount(StatKind.IF), is(4));
		assertThat(stats.getCount(StatKind.IF_ERR), is(3));
		assertThat(lines(stats.getPositions(StatKind.SINGLE_STMT_HANDLER)), is(java.util.Arrays.asList("test.go:5")));
		assertThat(lines(stats.getPositions(StatKind.MULTI_STMT_HANDLER)), is(java.util.Arrays.asList("test.go:8")));
		assertThat(lines(stats.getPositions(StatKind.NON_ZERO_RESULTS)), is(java.util.Arrays.asList("test.go:12")));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(0));
	}

}
