package gotry.parser;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;
import org.junit.Test;

import gotry.model.golang.*;
import gotry.model.golang.type.GoPtrType;
import gotry.model.golang.type.GoTypeName;

public class GoParserTest {

	static Path testFile = Paths.get("TEST");
	static Path roundTripFile = Paths.get("test", "go", "roundtrip.go");

	private static GoModule parse(String source) throws GoParseException {
		return GoParser.parse(testFile, source);
	}

	@Test
	public void formattingReproducesCanonicalFile() throws IOException {
		String contents = FileUtils.readFileToString(roundTripFile.toFile(), StandardCharsets.UTF_8);
		GoModule module = GoParser.parse(roundTripFile, contents);
		assertThat(module.toString(), is(contents));
	}

	@Test
	public void moduleStructure() throws IOException {
		String contents = FileUtils.readFileToString(roundTripFile.toFile(), StandardCharsets.UTF_8);
		GoModule module = GoParser.parse(roundTripFile, contents);

		assertThat(module.getPackageName(), is("p"));
		assertThat(module.getImports().size(), is(2));
		assertThat(module.getImports().get(0).getName(), is(nullValue()));
		assertThat(module.getImports().get(1).getName(), is("f"));
		assertThat(module.getDeclarations().size(), is(3));

		GoTypeDeclaration pair = (GoTypeDeclaration) module.getDeclarations().get(0);
		assertThat(pair.getName(), is("pair"));
		assertThat(pair.getTypeParameters().size(), is(2));

		GoFunctionDeclaration get = (GoFunctionDeclaration) module.getDeclarations().get(1);
		assertThat(get.getName(), is("get"));
		assertThat(get.getReceiver().getNames(), hasItem("p"));
		assertThat(get.getReceiver().getType(), instanceOf(GoPtrType.class));
		assertThat(get.getResults().size(), is(2));
		assertEquals(new GoTypeName("error"), get.getResults().get(1).getType());
		assertThat(get.getBody().getStatements().size(), is(2));
		assertThat(get.getBody().getStatements().get(0), instanceOf(GoIf.class));
		assertThat(get.getBody().getStatements().get(1), instanceOf(GoReturn.class));
	}

	@Test
	public void locationsSpanWholeStatements() throws GoParseException {
		GoModule module = parse("package p\n\nfunc f() error {\n\tx, err := g()\n\tif err != nil {\n\t\treturn err\n\t}\n\treturn nil\n}\n");
		GoFunctionDeclaration f = (GoFunctionDeclaration) module.getDeclarations().get(0);
		GoStatement assignment = f.getBody().getStatements().get(0);
		GoStatement goIf = f.getBody().getStatements().get(1);
		assertThat(assignment.getLocation().getStartLine(), is(4));
		assertThat(assignment.getLocation().getStartColumn(), is(2));
		assertThat(goIf.getLocation().getStartLine(), is(5));
		assertThat(goIf.getLocation().getEndLine(), is(7));
		assertThat(goIf.getLocation().getEndColumn(), is(3));
	}

	@Test
	public void compositeLiteralNotAllowedInIfHeader() throws GoParseException {
		GoModule module = parse("package p\n\nfunc f() {\n\tif x == T {\n\t}\n}\n");
		GoFunctionDeclaration f = (GoFunctionDeclaration) module.getDeclarations().get(0);
		GoIf goIf = (GoIf) f.getBody().getStatements().get(0);
		assertThat(goIf.getCond(), instanceOf(GoBinop.class));
		assertThat(((GoBinop) goIf.getCond()).getRHS(), is(new GoVariableName("T")));
	}

	@Test
	public void parenthesizedCompositeLiteralInIfHeader() throws GoParseException {
		GoModule module = parse("package p\n\nfunc f() {\n\tif x == (T{}) {\n\t}\n}\n");
		GoFunctionDeclaration f = (GoFunctionDeclaration) module.getDeclarations().get(0);
		GoIf goIf = (GoIf) f.getBody().getStatements().get(0);
		GoExpression rhs = ((GoBinop) goIf.getCond()).getRHS();
		assertThat(((GoParenthesized) rhs).getInner(), instanceOf(GoCompositeLiteral.class));
	}

	@Test
	public void functionWithoutBody() throws GoParseException {
		GoModule module = parse("package p\n\nfunc external(x int) error\n");
		GoFunctionDeclaration f = (GoFunctionDeclaration) module.getDeclarations().get(0);
		assertThat(f.getBody(), is(nullValue()));
	}

	@Test
	public void groupedDeclarations() throws GoParseException {
		GoModule module = parse("package p\n\nconst (\n\ta = iota\n\tb\n)\n\nvar x, y int\n");
		assertThat(module.getDeclarations().size(), is(3));
		GoVariableDeclaration b = (GoVariableDeclaration) module.getDeclarations().get(1);
		assertThat(b.isConstant(), is(true));
		assertThat(b.getNames(), hasItem("b"));
		GoVariableDeclaration xy = (GoVariableDeclaration) module.getDeclarations().get(2);
		assertThat(xy.getNames().size(), is(2));
	}

	@Test
	public void reportsLocationOfParseError() {
		try {
			parse("package p\n\nfunc f() {\n\tx := \n}\n");
			fail("expected a parse error");
		} catch (GoParseException e) {
			assertThat(e.getLocation().getStartLine(), is(5));
		}
	}

	@Test(expected = GoParseException.class)
	public void missingPackageClause() throws GoParseException {
		parse("func f() {}\n");
	}

}
