package gotry.trans.output;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import gotry.model.golang.GoFunctionDeclaration;
import gotry.model.golang.GoModule;
import gotry.model.golang.GoStatement;
import gotry.parser.GoParseException;
import gotry.parser.GoParser;
import gotry.stats.Stats;
import gotry.trans.passes.trycheck.TryCandidateOptions;
import gotry.trans.passes.trycheck.TryCandidatePass;

public class GoSourceSplicerTest {

	static Path testFile = Paths.get("TEST");

	private static String rewrite(String source) throws GoParseException {
		GoModule module = GoParser.parse(testFile, source);
		TryCandidatePass.perform(module, new TryCandidateOptions(true), new Stats());
		return GoSourceSplicer.splice(source, module);
	}

	private static String lines(String... lines) {
		return String.join("\n", lines) + "\n";
	}

	@Test
	public void unmodifiedSourceIsReturnedAsIs() throws GoParseException {
		String source = lines(
				"package p",
				"",
				"// f has no candidates",
				"func f() error {",
				"\tif err := g(); err != nil {",
				"\t\treturn   wrap(err) // odd spacing",
				"\t}",
				"\treturn nil",
				"}");
		assertThat(rewrite(source), is(source));
	}

	@Test
	public void separateAndInitializerForms() throws GoParseException {
		String source = lines(
				"package p",
				"",
				"import \"os\"",
				"",
				"// f reads a file.",
				"func f(name string) ([]byte, error) {",
				"\t/* open */",
				"\tfile, err := os.Open( name )",
				"\tif err != nil {",
				"\t\treturn nil, err",
				"\t}",
				"\tdefer file.Close() // always",
				"\tif _, err = file.Seek(0, 0); err != nil {",
				"\t\treturn nil, err",
				"\t}",
				"\treturn read(file)",
				"}");
		assertThat(rewrite(source), is(lines(
				"package p",
				"",
				"import \"os\"",
				"",
				"// f reads a file.",
				"func f(name string) ([]byte, error) {",
				"\t/* open */",
				"\tfile := try(os.Open( name ))",
				"\tdefer file.Close() // always",
				"\tif try(file.Seek(0, 0)); err != nil {",
				"\t\treturn nil, err",
				"\t}",
				"\treturn read(file)",
				"}")));
	}

	@Test
	public void nestedStatementsAndSeveralFunctions() throws GoParseException {
		String source = lines(
				"package p",
				"",
				"func f(xs []string) (n int, err error) {",
				"\tfor _, x := range xs {",
				"\t\tswitch {",
				"\t\tcase x != \"\":",
				"\t\t\tn, err = g(x)",
				"\t\t\tif err != nil {",
				"\t\t\t\treturn",
				"\t\t\t}",
				"\t\t}",
				"\t}",
				"\treturn",
				"}",
				"",
				"func h() error {",
				"\terr := k()",
				"\tif err != nil {",
				"\t\treturn err",
				"\t}",
				"\treturn nil",
				"}");
		assertThat(rewrite(source), is(lines(
				"package p",
				"",
				"func f(xs []string) (n int, err error) {",
				"\tfor _, x := range xs {",
				"\t\tswitch {",
				"\t\tcase x != \"\":",
				"\t\t\tn = try(g(x))",
				"\t\t}",
				"\t}",
				"\treturn",
				"}",
				"",
				"func h() error {",
				"\ttry(k())",
				"\treturn nil",
				"}")));
	}

	@Test
	public void userFunctionNamedTryIsNotATryStatement() throws GoParseException {
		GoModule module = GoParser.parse(testFile, lines(
				"package p",
				"",
				"func f() {",
				"\ttry(g())",
				"\tx = try(g())",
				"}"));
		for (GoStatement statement : ((GoFunctionDeclaration) module.getDeclarations().get(0)).getBody().getStatements()) {
			assertThat(GoSourceSplicer.isTryStatement(statement), is(false));
		}
		assertThat(GoSourceSplicer.splice("ignored", module), is("ignored"));
	}

}
