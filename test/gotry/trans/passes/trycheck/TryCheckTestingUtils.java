package gotry.trans.passes.trycheck;

import gotry.model.golang.GoExpression;
import gotry.model.golang.GoFunctionDeclaration;
import gotry.model.golang.GoModule;
import gotry.model.golang.GoStatement;
import gotry.parser.GoParseException;
import gotry.parser.GoParser;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Builds small Go files for the try candidate tests. Function bodies built by {@link #function} start on line 4.
 */
final class TryCheckTestingUtils {

	static final Path TEST_FILE = Paths.get("test.go");

	private TryCheckTestingUtils() {}

	static GoModule function(String signature, String... body) throws GoParseException {
		StringBuilder source = new StringBuilder("package p\n\nfunc ");
		source.append(signature).append(" {\n");
		for (String line : body) {
			source.append('\t').append(line).append('\n');
		}
		source.append("}\n");
		return GoParser.parse(TEST_FILE, source.toString());
	}

	static GoFunctionDeclaration firstFunction(GoModule module) {
		return (GoFunctionDeclaration) module.getDeclarations().get(0);
	}

	static List<GoStatement> body(GoModule module) {
		return firstFunction(module).getBody().getStatements();
	}

	static GoExpression expr(String source) throws GoParseException {
		return GoParser.readExpression(TEST_FILE, source);
	}
}
