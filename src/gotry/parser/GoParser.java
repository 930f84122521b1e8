package gotry.parser;

import gotry.lexer.GoLexer;
import gotry.lexer.GoToken;
import gotry.lexer.GoTokenType;
import gotry.model.golang.*;
import gotry.model.golang.type.*;
import gotry.util.SourceLocation;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A recursive-descent parser for Go source files.
 *
 * The parser accepts the language as written in practice, generics included, but makes no attempt to report
 * every static error: it only needs to build a tree faithful enough to find and rewrite error checks. Explicit
 * parentheses are kept as {@link GoParenthesized} nodes so that formatting a parsed expression reproduces its
 * grouping.
 *
 * Composite literals whose type is a bare or qualified type name are not allowed in the header of if, for and
 * switch statements unless parenthesized (exprLev < 0), as in the Go compiler: in "if x == T {" the brace opens
 * the block.
 */
public class GoParser {

	private static final Set<String> TYPE_START_KEYWORDS = new HashSet<>(Arrays.asList(
			"func", "map", "chan", "struct", "interface"));

	private final List<GoToken> tokens;
	private int pos = 0;
	private int exprLev = 0;

	private GoParser(List<GoToken> tokens) {
		this.tokens = tokens;
	}

	/**
	 * Parses one Go source file.
	 *
	 * @param file the path reported in source locations
	 * @param contents the full text of the file
	 * @throws GoParseException if the file cannot be tokenized or parsed
	 */
	public static GoModule parse(Path file, String contents) throws GoParseException {
		GoParser parser = new GoParser(new GoLexer(file, contents).readTokens());
		return parser.parseModule();
	}

	/**
	 * Parses contents as a single Go expression.
	 */
	public static GoExpression readExpression(Path file, String contents) throws GoParseException {
		GoParser parser = new GoParser(new GoLexer(file, contents).readTokens());
		GoExpression expression = parser.parseExpression();
		if (parser.atSemicolon()) {
			parser.next();
		}
		if (parser.peek().getType() != GoTokenType.EOF) {
			throw parser.error("end of expression");
		}
		return expression;
	}

	// token helpers

	private GoToken peek() {
		return tokens.get(pos);
	}

	private GoToken peek(int n) {
		return tokens.get(Integer.min(pos + n, tokens.size() - 1));
	}

	private GoToken next() {
		GoToken t = tokens.get(pos);
		if (t.getType() != GoTokenType.EOF) {
			++pos;
		}
		return t;
	}

	private GoToken previous() {
		return tokens.get(pos - 1);
	}

	private static boolean isOp(GoToken t, String op) {
		return t.is(GoTokenType.OPERATOR, op);
	}

	private static boolean isKeyword(GoToken t, String keyword) {
		return t.is(GoTokenType.KEYWORD, keyword);
	}

	private boolean atOp(String op) {
		return isOp(peek(), op);
	}

	private boolean atKeyword(String keyword) {
		return isKeyword(peek(), keyword);
	}

	private boolean atSemicolon() {
		return peek().getType() == GoTokenType.SEMICOLON;
	}

	private boolean acceptOp(String op) {
		if (atOp(op)) {
			next();
			return true;
		}
		return false;
	}

	private GoParseException error(String expected) {
		return new GoParseException("expected " + expected + ", found " + peek().describe(), peek().getLocation());
	}

	private GoToken expectOp(String op) throws GoParseException {
		if (!atOp(op)) {
			throw error("'" + op + "'");
		}
		return next();
	}

	private GoToken expectKeyword(String keyword) throws GoParseException {
		if (!atKeyword(keyword)) {
			throw error("'" + keyword + "'");
		}
		return next();
	}

	private String expectIdent() throws GoParseException {
		if (peek().getType() != GoTokenType.IDENT) {
			throw error("identifier");
		}
		return next().getValue();
	}

	/**
	 * Consumes a statement or declaration terminator. The terminator may be omitted before a closing ")" or "}".
	 */
	private void expectSemicolon() throws GoParseException {
		if (atSemicolon()) {
			next();
		} else if (!atOp(")") && !atOp("}") && peek().getType() != GoTokenType.EOF) {
			throw error("';' or newline");
		}
	}

	private <T extends GoNode> T located(T node, GoToken first) {
		node.setLocation(first.getLocation().combine(previous().getLocation()));
		return node;
	}

	private <T extends GoNode> T located(T node, SourceLocation start) {
		node.setLocation(start.combine(previous().getLocation()));
		return node;
	}

	// declarations

	private GoModule parseModule() throws GoParseException {
		GoToken first = peek();
		expectKeyword("package");
		String packageName = expectIdent();
		expectSemicolon();
		List<GoImport> imports = new ArrayList<>();
		while (atKeyword("import")) {
			next();
			if (acceptOp("(")) {
				while (!atOp(")")) {
					imports.add(parseImportSpec());
					expectSemicolon();
				}
				expectOp(")");
			} else {
				imports.add(parseImportSpec());
			}
			expectSemicolon();
		}
		List<GoDeclaration> declarations = new ArrayList<>();
		while (peek().getType() != GoTokenType.EOF) {
			if (atKeyword("func")) {
				declarations.add(parseFunctionDeclaration());
			} else if (atKeyword("var") || atKeyword("const") || atKeyword("type")) {
				declarations.addAll(parseDeclaration());
			} else if (atKeyword("import")) {
				throw new GoParseException("imports must appear before other declarations", peek().getLocation());
			} else {
				throw error("declaration");
			}
			expectSemicolon();
		}
		return located(new GoModule(packageName, imports, declarations), first);
	}

	private GoImport parseImportSpec() throws GoParseException {
		GoToken first = peek();
		String name = null;
		if (peek().getType() == GoTokenType.IDENT) {
			name = next().getValue();
		} else if (atOp(".")) {
			name = next().getValue();
		}
		if (peek().getType() != GoTokenType.STRING) {
			throw error("import path");
		}
		GoStringLiteral path = located(new GoStringLiteral(next().getValue()), previous());
		return located(new GoImport(name, path), first);
	}

	/**
	 * Parses a var, const or type declaration, returning one declaration per spec.
	 */
	private List<GoDeclaration> parseDeclaration() throws GoParseException {
		GoToken keyword = next();
		List<GoDeclaration> declarations = new ArrayList<>();
		if (acceptOp("(")) {
			while (!atOp(")")) {
				declarations.add(parseSpec(keyword.getValue()));
				expectSemicolon();
			}
			expectOp(")");
		} else {
			declarations.add(parseSpec(keyword.getValue()));
		}
		return declarations;
	}

	private GoDeclaration parseSpec(String keyword) throws GoParseException {
		GoToken first = peek();
		if (keyword.equals("type")) {
			String name = expectIdent();
			List<GoField> typeParameters = Collections.emptyList();
			if (atOp("[") && isTypeParameterList()) {
				typeParameters = parseParameters("[", "]");
			}
			boolean alias = acceptOp("=");
			GoExpression type = parseType();
			return located(new GoTypeDeclaration(name, typeParameters, alias, type), first);
		}
		boolean constant = keyword.equals("const");
		List<String> names = parseIdentList();
		GoExpression type = null;
		if (!atOp("=") && !atSemicolon() && !atOp(")")) {
			type = parseType();
		}
		List<GoExpression> values = new ArrayList<>();
		if (acceptOp("=")) {
			values = parseExpressionList();
		}
		return located(new GoVariableDeclaration(constant, names, type, values), first);
	}

	/**
	 * Decides whether the "[" after a type name opens a type parameter list ("type L[T any] ...") rather than an
	 * array length ("type A [N]int").
	 */
	private boolean isTypeParameterList() {
		GoToken first = peek(1);
		if (first.getType() != GoTokenType.IDENT) {
			return false;
		}
		GoToken second = peek(2);
		return second.getType() == GoTokenType.IDENT || isOp(second, ",") || isOp(second, "[") ||
				isOp(second, "~") || isOp(second, "(") || isOp(second, "<-") ||
				(second.getType() == GoTokenType.KEYWORD && TYPE_START_KEYWORDS.contains(second.getValue())) ||
				(isOp(second, "*") && peek(3).getType() == GoTokenType.IDENT && !isOp(peek(4), "]"));
	}

	private List<String> parseIdentList() throws GoParseException {
		List<String> names = new ArrayList<>();
		names.add(expectIdent());
		while (acceptOp(",")) {
			names.add(expectIdent());
		}
		return names;
	}

	private GoFunctionDeclaration parseFunctionDeclaration() throws GoParseException {
		GoToken first = expectKeyword("func");
		GoField receiver = null;
		if (atOp("(")) {
			List<GoField> receivers = parseParameters("(", ")");
			if (receivers.size() != 1) {
				throw new GoParseException("method has multiple receivers", previous().getLocation());
			}
			receiver = receivers.get(0);
		}
		String name = expectIdent();
		GoToken signatureStart = peek();
		List<GoField> typeParameters = Collections.emptyList();
		if (atOp("[")) {
			typeParameters = parseParameters("[", "]");
		}
		GoFuncType type = parseSignature(typeParameters, signatureStart);
		GoBlock body = null;
		if (atOp("{")) {
			int oldExprLev = exprLev;
			exprLev = 0;
			body = parseBlock();
			exprLev = oldExprLev;
		}
		return located(new GoFunctionDeclaration(name, receiver, type, body), first);
	}

	// signatures and types

	private GoFuncType parseSignature(List<GoField> typeParameters, GoToken first) throws GoParseException {
		List<GoField> parameters = parseParameters("(", ")");
		List<GoField> results;
		if (atOp("(")) {
			results = parseParameters("(", ")");
		} else if (isTypeStart(peek())) {
			GoToken resultStart = peek();
			GoExpression type = parseType();
			results = new ArrayList<>();
			results.add(located(new GoField(Collections.emptyList(), type), resultStart));
		} else {
			results = new ArrayList<>();
		}
		return located(new GoFuncType(typeParameters, parameters, results), first);
	}

	private static boolean isTypeStart(GoToken t) {
		if (t.getType() == GoTokenType.IDENT) {
			return true;
		}
		if (t.getType() == GoTokenType.KEYWORD) {
			return TYPE_START_KEYWORDS.contains(t.getValue());
		}
		return isOp(t, "*") || isOp(t, "[") || isOp(t, "(") || isOp(t, "<-");
	}

	/**
	 * One entry of a parameter list before names are grouped with their types: a lone name or type, or a
	 * name followed by a type.
	 */
	private static final class ParameterEntry {
		final GoToken first;
		final String name;
		final GoExpression type;

		ParameterEntry(GoToken first, String name, GoExpression type) {
			this.first = first;
			this.name = name;
			this.type = type;
		}
	}

	/**
	 * Parses a parameter, result or type parameter list. Go allows either all entries to be named, with
	 * consecutive names sharing the following type ("a, b int, c string"), or none ("int, string").
	 */
	private List<GoField> parseParameters(String open, String close) throws GoParseException {
		expectOp(open);
		List<ParameterEntry> entries = new ArrayList<>();
		boolean named = false;
		while (!atOp(close)) {
			GoToken first = peek();
			if (peek().getType() == GoTokenType.IDENT && !isOp(peek(1), ".") && !(isOp(peek(1), "[") && !isNameThenBracketType(1))) {
				String ident = next().getValue();
				if (atOp(",") || atOp(close)) {
					entries.add(new ParameterEntry(first, ident, null));
				} else {
					named = true;
					entries.add(new ParameterEntry(first, ident, parseParameterType()));
				}
			} else {
				entries.add(new ParameterEntry(first, null, parseParameterType()));
			}
			if (!acceptOp(",")) {
				break;
			}
		}
		expectOp(close);

		List<GoField> fields = new ArrayList<>();
		if (named) {
			List<String> pending = new ArrayList<>();
			GoToken pendingStart = null;
			for (ParameterEntry entry : entries) {
				if (entry.name == null) {
					throw new GoParseException("mixed named and unnamed parameters", entry.first.getLocation());
				}
				if (pendingStart == null) {
					pendingStart = entry.first;
				}
				pending.add(entry.name);
				if (entry.type != null) {
					GoField field = new GoField(pending, entry.type);
					field.setLocation(pendingStart.getLocation().combine(entry.type.getLocation()));
					fields.add(field);
					pending = new ArrayList<>();
					pendingStart = null;
				}
			}
			if (!pending.isEmpty()) {
				throw new GoParseException("missing parameter type", pendingStart.getLocation());
			}
		} else {
			for (ParameterEntry entry : entries) {
				GoExpression type = entry.type;
				if (type == null) {
					type = new GoTypeName(entry.name);
					type.setLocation(entry.first.getLocation());
				}
				GoField field = new GoField(Collections.emptyList(), type);
				field.setLocation(type.getLocation());
				fields.add(field);
			}
		}
		return fields;
	}

	private GoExpression parseParameterType() throws GoParseException {
		if (atOp("...")) {
			GoToken first = next();
			return located(new GoEllipsis(parseType()), first);
		}
		if (atOp("~")) {
			return parseTypeUnion();
		}
		GoExpression type = parseType();
		if (atOp("|")) {
			// a union constraint written inline: [T int | float64]
			return parseUnionRest(type);
		}
		return type;
	}

	/**
	 * With the current token at offset-1 being an identifier and the token at offset being "[", decides whether
	 * the brackets belong to an array or slice type following a name ("buf [4]byte") rather than to a generic
	 * instantiation of that identifier ("List[int]").
	 */
	private boolean isNameThenBracketType(int offset) {
		if (isOp(peek(offset + 1), "]")) {
			return true;
		}
		int depth = 0;
		int i = offset;
		while (peek(i).getType() != GoTokenType.EOF) {
			GoToken t = peek(i);
			if (isOp(t, "[") || isOp(t, "(") || isOp(t, "{")) {
				++depth;
			} else if (isOp(t, "]") || isOp(t, ")") || isOp(t, "}")) {
				--depth;
				if (depth == 0) {
					return isTypeStart(peek(i + 1)) && !isOp(peek(i + 1), "(");
				}
			}
			++i;
		}
		return false;
	}

	private GoExpression parseTypeUnion() throws GoParseException {
		return parseUnionRest(parseTypeTerm());
	}

	private GoExpression parseTypeTerm() throws GoParseException {
		if (atOp("~")) {
			GoToken first = next();
			return located(new GoUnary(GoUnary.Operation.TILDE, parseType()), first);
		}
		return parseType();
	}

	private GoExpression parseUnionRest(GoExpression lhs) throws GoParseException {
		SourceLocation start = lhs.getLocation();
		while (acceptOp("|")) {
			GoExpression rhs = parseTypeTerm();
			lhs = located(new GoBinop(GoBinop.Operation.BOR, lhs, rhs), start);
		}
		return lhs;
	}

	/**
	 * Parses a type in a type-only context
	 */
	GoExpression parseType() throws GoParseException {
		GoToken first = peek();
		if (first.getType() == GoTokenType.IDENT) {
			next();
			GoTypeName name;
			if (atOp(".")) {
				next();
				name = located(new GoTypeName(first.getValue(), expectIdent()), first);
			} else {
				name = located(new GoTypeName(first.getValue()), first);
			}
			if (atOp("[")) {
				next();
				List<GoExpression> arguments = new ArrayList<>();
				int oldExprLev = exprLev;
				exprLev++;
				while (!atOp("]")) {
					arguments.add(parseType());
					if (!acceptOp(",")) {
						break;
					}
				}
				exprLev = oldExprLev;
				expectOp("]");
				return located(new GoIndexExpression(name, arguments), first);
			}
			return name;
		}
		if (isOp(first, "(")) {
			next();
			GoExpression inner = parseType();
			expectOp(")");
			return located(new GoParenthesized(inner), first);
		}
		GoExpression type = parseTypeLiteral();
		if (type == null) {
			throw error("type");
		}
		return type;
	}

	/**
	 * Parses a type that starts with a keyword or operator: pointer, array, slice, map, channel, function, struct
	 * or interface types.
	 *
	 * @return the type, or null if the current token cannot start one
	 */
	private GoExpression parseTypeLiteral() throws GoParseException {
		GoToken first = peek();
		if (isOp(first, "*")) {
			next();
			return located(new GoPtrType(parseType()), first);
		}
		if (isOp(first, "[")) {
			next();
			GoExpression length = null;
			if (atOp("...")) {
				GoToken ellipsis = next();
				length = located(new GoEllipsis(null), ellipsis);
			} else if (!atOp("]")) {
				int oldExprLev = exprLev;
				exprLev++;
				length = parseExpression();
				exprLev = oldExprLev;
			}
			expectOp("]");
			return located(new GoArrayType(length, parseType()), first);
		}
		if (isOp(first, "<-")) {
			next();
			expectKeyword("chan");
			return located(new GoChanType(GoChanType.Direction.RECV, parseType()), first);
		}
		if (first.getType() != GoTokenType.KEYWORD) {
			return null;
		}
		switch (first.getValue()) {
			case "map": {
				next();
				expectOp("[");
				GoExpression key = parseType();
				expectOp("]");
				return located(new GoMapType(key, parseType()), first);
			}
			case "chan": {
				next();
				GoChanType.Direction direction = GoChanType.Direction.BOTH;
				if (acceptOp("<-")) {
					direction = GoChanType.Direction.SEND;
				}
				return located(new GoChanType(direction, parseType()), first);
			}
			case "func":
				next();
				return parseSignature(Collections.emptyList(), first);
			case "struct":
				next();
				return located(new GoStructType(parseStructFields()), first);
			case "interface":
				next();
				return located(new GoInterfaceType(parseInterfaceElements()), first);
			default:
				return null;
		}
	}

	private List<GoField> parseStructFields() throws GoParseException {
		expectOp("{");
		List<GoField> fields = new ArrayList<>();
		while (!atOp("}")) {
			GoToken first = peek();
			List<String> names;
			GoExpression type;
			boolean embedded = atOp("*") ||
					(peek().getType() == GoTokenType.IDENT && (isOp(peek(1), ".") || atFieldEnd(1) ||
							(isOp(peek(1), "[") && !isNameThenBracketType(1))));
			if (embedded) {
				names = Collections.emptyList();
				type = parseType();
			} else {
				names = parseIdentList();
				type = parseType();
			}
			GoStringLiteral tag = null;
			if (peek().getType() == GoTokenType.STRING) {
				tag = located(new GoStringLiteral(next().getValue()), previous());
			}
			fields.add(located(new GoField(names, type, tag), first));
			expectSemicolon();
		}
		expectOp("}");
		return fields;
	}

	private boolean atFieldEnd(int offset) {
		GoToken t = peek(offset);
		return t.getType() == GoTokenType.SEMICOLON || t.getType() == GoTokenType.STRING || isOp(t, "}");
	}

	private List<GoField> parseInterfaceElements() throws GoParseException {
		expectOp("{");
		List<GoField> elements = new ArrayList<>();
		while (!atOp("}")) {
			GoToken first = peek();
			if (peek().getType() == GoTokenType.IDENT && isOp(peek(1), "(")) {
				String name = next().getValue();
				GoFuncType signature = parseSignature(Collections.emptyList(), peek());
				List<String> names = new ArrayList<>();
				names.add(name);
				elements.add(located(new GoField(names, signature), first));
			} else {
				elements.add(located(new GoField(Collections.emptyList(), parseTypeUnion()), first));
			}
			expectSemicolon();
		}
		expectOp("}");
		return elements;
	}

	// statements

	private GoBlock parseBlock() throws GoParseException {
		GoToken first = expectOp("{");
		List<GoStatement> statements = parseStatementList();
		expectOp("}");
		return located(new GoBlock(statements), first);
	}

	private boolean atStatementListEnd() {
		return atOp("}") || atKeyword("case") || atKeyword("default") || peek().getType() == GoTokenType.EOF;
	}

	private List<GoStatement> parseStatementList() throws GoParseException {
		List<GoStatement> statements = new ArrayList<>();
		while (!atStatementListEnd()) {
			statements.add(parseStatement());
			expectSemicolon();
		}
		return statements;
	}

	private GoStatement parseStatement() throws GoParseException {
		GoToken first = peek();
		if (first.getType() == GoTokenType.SEMICOLON) {
			GoEmptyStatement empty = new GoEmptyStatement();
			empty.setLocation(first.getLocation());
			return empty;
		}
		if (first.getType() == GoTokenType.IDENT && isOp(peek(1), ":")) {
			next();
			next();
			GoStatement statement;
			if (atOp("}")) {
				statement = new GoEmptyStatement();
				statement.setLocation(previous().getLocation());
			} else {
				statement = parseStatement();
			}
			return located(new GoLabeledStatement(first.getValue(), statement), first);
		}
		if (first.getType() == GoTokenType.KEYWORD) {
			switch (first.getValue()) {
				case "var":
				case "const":
				case "type":
					return located(new GoDeclarationStatement(parseDeclaration()), first);
				case "go":
					next();
					return located(new GoRoutineStatement(parseExpression()), first);
				case "defer":
					next();
					return located(new GoDefer(parseExpression()), first);
				case "return": {
					next();
					List<GoExpression> values = new ArrayList<>();
					if (!atSemicolon() && !atOp("}")) {
						values = parseExpressionList();
					}
					return located(new GoReturn(values), first);
				}
				case "break":
					next();
					return located(new GoBreak(parseOptionalLabel()), first);
				case "continue":
					next();
					return located(new GoContinue(parseOptionalLabel()), first);
				case "goto":
					next();
					return located(new GoTo(expectIdent()), first);
				case "fallthrough":
					next();
					return located(new GoFallthrough(), first);
				case "if":
					return parseIf();
				case "switch":
					return parseSwitch();
				case "select":
					return parseSelect();
				case "for":
					return parseFor();
				default:
					break;
			}
		}
		if (isOp(first, "{")) {
			return parseBlock();
		}
		return parseSimpleStatement();
	}

	private String parseOptionalLabel() {
		if (peek().getType() == GoTokenType.IDENT) {
			return next().getValue();
		}
		return null;
	}

	private GoStatement parseSimpleStatement() throws GoParseException {
		GoToken first = peek();
		return parseSimpleStatementRest(first, parseExpressionList());
	}

	/**
	 * Finishes a simple statement whose leading expression list has already been parsed
	 */
	private GoStatement parseSimpleStatementRest(GoToken first, List<GoExpression> lhs) throws GoParseException {
		GoToken t = peek();
		if (isOp(t, ":=") || isOp(t, "=")) {
			next();
			List<GoExpression> rhs = parseExpressionList();
			return located(new GoAssignmentStatement(lhs, isOp(t, ":="), rhs), first);
		}
		if (t.getType() == GoTokenType.OPERATOR && t.getValue().length() >= 2 && t.getValue().endsWith("=") &&
				!isOp(t, "==") && !isOp(t, "!=") && !isOp(t, "<=") && !isOp(t, ">=")) {
			GoBinop.Operation operation = GoBinop.Operation.fromSymbol(
					t.getValue().substring(0, t.getValue().length() - 1));
			next();
			if (lhs.size() != 1) {
				throw new GoParseException("assignment operation " + t.getValue() + " requires single-valued expressions",
						t.getLocation());
			}
			GoExpression rhs = parseExpression();
			return located(new GoOperatorAssignment(lhs.get(0), operation, rhs), first);
		}
		if (lhs.size() > 1) {
			throw error("':=' or '=' or comma");
		}
		if (isOp(t, "<-")) {
			next();
			GoExpression value = parseExpression();
			return located(new GoSend(lhs.get(0), value), first);
		}
		if (isOp(t, "++") || isOp(t, "--")) {
			next();
			return located(new GoIncDec(isOp(t, "++"), lhs.get(0)), first);
		}
		return located(new GoExpressionStatement(lhs.get(0)), first);
	}

	private GoIf parseIf() throws GoParseException {
		GoToken first = expectKeyword("if");
		int oldExprLev = exprLev;
		exprLev = -1;
		GoStatement init = null;
		GoExpression cond;
		if (atOp("{")) {
			throw error("condition");
		}
		if (atSemicolon()) {
			next();
			cond = parseExpression();
		} else {
			GoStatement s = parseSimpleStatement();
			if (atSemicolon()) {
				next();
				init = s;
				cond = parseExpression();
			} else if (s instanceof GoExpressionStatement) {
				cond = ((GoExpressionStatement) s).getExpression();
			} else {
				throw new GoParseException("cannot use " + s.toString().trim() + " as value", s.getLocation());
			}
		}
		exprLev = oldExprLev;
		GoBlock then = parseBlock();
		GoStatement bElse = null;
		if (atKeyword("else")) {
			next();
			if (atKeyword("if")) {
				bElse = parseIf();
			} else if (atOp("{")) {
				bElse = parseBlock();
			} else {
				throw error("if statement or block");
			}
		}
		return located(new GoIf(init, cond, then, bElse), first);
	}

	private static boolean isTypeSwitchGuard(GoStatement s) {
		GoExpression x = null;
		if (s instanceof GoExpressionStatement) {
			x = ((GoExpressionStatement) s).getExpression();
		} else if (s instanceof GoAssignmentStatement) {
			GoAssignmentStatement assignment = (GoAssignmentStatement) s;
			if (assignment.isDefinition() && assignment.getNames().size() == 1 && assignment.getValues().size() == 1) {
				x = assignment.getValues().get(0);
			}
		}
		return x instanceof GoTypeAssertion && ((GoTypeAssertion) x).getType() == null;
	}

	private GoStatement parseSwitch() throws GoParseException {
		GoToken first = expectKeyword("switch");
		int oldExprLev = exprLev;
		exprLev = -1;
		GoStatement init = null;
		GoStatement header = null;
		if (!atOp("{")) {
			if (!atSemicolon()) {
				header = parseSimpleStatement();
			}
			if (atSemicolon()) {
				next();
				init = header;
				header = null;
				if (!atOp("{")) {
					header = parseSimpleStatement();
				}
			}
		}
		exprLev = oldExprLev;
		boolean typeSwitch = header != null && isTypeSwitchGuard(header);
		expectOp("{");
		List<GoSwitchCase> cases = new ArrayList<>();
		while (atKeyword("case") || atKeyword("default")) {
			GoToken caseStart = next();
			List<GoExpression> conditions = new ArrayList<>();
			if (isKeyword(caseStart, "case")) {
				conditions = parseExpressionList();
			}
			expectOp(":");
			List<GoStatement> block = parseStatementList();
			cases.add(located(new GoSwitchCase(conditions, block), caseStart));
		}
		expectOp("}");
		if (typeSwitch) {
			return located(new GoTypeSwitch(init, header, cases), first);
		}
		GoExpression tag = null;
		if (header != null) {
			if (!(header instanceof GoExpressionStatement)) {
				throw new GoParseException("switch expression must be an expression", header.getLocation());
			}
			tag = ((GoExpressionStatement) header).getExpression();
		}
		return located(new GoSwitch(init, tag, cases), first);
	}

	private GoSelect parseSelect() throws GoParseException {
		GoToken first = expectKeyword("select");
		expectOp("{");
		List<GoSelectCase> cases = new ArrayList<>();
		while (atKeyword("case") || atKeyword("default")) {
			GoToken caseStart = next();
			GoStatement comm = null;
			if (isKeyword(caseStart, "case")) {
				comm = parseSimpleStatement();
			}
			expectOp(":");
			List<GoStatement> block = parseStatementList();
			cases.add(located(new GoSelectCase(comm, block), caseStart));
		}
		expectOp("}");
		return located(new GoSelect(cases), first);
	}

	private GoStatement parseFor() throws GoParseException {
		GoToken first = expectKeyword("for");
		int oldExprLev = exprLev;
		exprLev = -1;
		if (atOp("{")) {
			exprLev = oldExprLev;
			return located(new GoFor(null, null, null, parseBlock()), first);
		}
		if (atKeyword("range")) {
			next();
			GoExpression range = parseExpression();
			exprLev = oldExprLev;
			return located(new GoForRange(new ArrayList<>(), false, range, parseBlock()), first);
		}
		GoStatement init = null;
		GoExpression cond = null;
		GoStatement post = null;
		if (!atSemicolon()) {
			GoToken headerStart = peek();
			List<GoExpression> lhs = parseExpressionList();
			if ((atOp(":=") || atOp("=")) && isKeyword(peek(1), "range")) {
				boolean defines = atOp(":=");
				next();
				next();
				GoExpression range = parseExpression();
				exprLev = oldExprLev;
				return located(new GoForRange(lhs, defines, range, parseBlock()), first);
			}
			GoStatement s = parseSimpleStatementRest(headerStart, lhs);
			if (!atSemicolon()) {
				if (!(s instanceof GoExpressionStatement)) {
					throw error("for loop condition");
				}
				exprLev = oldExprLev;
				return located(new GoFor(null, ((GoExpressionStatement) s).getExpression(), null, parseBlock()), first);
			}
			init = s;
		}
		next();
		if (!atSemicolon()) {
			cond = parseExpression();
		}
		if (!atSemicolon()) {
			throw error("';' in for clause");
		}
		next();
		if (!atOp("{")) {
			post = parseSimpleStatement();
		}
		exprLev = oldExprLev;
		return located(new GoFor(init, cond, post, parseBlock()), first);
	}

	// expressions

	private List<GoExpression> parseExpressionList() throws GoParseException {
		List<GoExpression> expressions = new ArrayList<>();
		expressions.add(parseExpression());
		while (acceptOp(",")) {
			expressions.add(parseExpression());
		}
		return expressions;
	}

	GoExpression parseExpression() throws GoParseException {
		return parseBinary(1);
	}

	private GoBinop.Operation binaryOperation(GoToken t) {
		if (t.getType() != GoTokenType.OPERATOR) {
			return null;
		}
		return GoBinop.Operation.fromSymbol(t.getValue());
	}

	private GoExpression parseBinary(int minPrecedence) throws GoParseException {
		GoExpression lhs = parseUnary();
		while (true) {
			GoBinop.Operation operation = binaryOperation(peek());
			if (operation == null || operation.getPrecedence() < minPrecedence) {
				return lhs;
			}
			next();
			GoExpression rhs = parseBinary(operation.getPrecedence() + 1);
			lhs = located(new GoBinop(operation, lhs, rhs), lhs.getLocation());
		}
	}

	private GoExpression parseUnary() throws GoParseException {
		GoToken first = peek();
		if (first.getType() == GoTokenType.OPERATOR) {
			GoUnary.Operation operation = null;
			switch (first.getValue()) {
				case "+":
					operation = GoUnary.Operation.POS;
					break;
				case "-":
					operation = GoUnary.Operation.NEG;
					break;
				case "!":
					operation = GoUnary.Operation.NOT;
					break;
				case "^":
					operation = GoUnary.Operation.COMPLEMENT;
					break;
				case "&":
					operation = GoUnary.Operation.ADDR;
					break;
				case "*":
					operation = GoUnary.Operation.DEREF;
					break;
				case "~":
					operation = GoUnary.Operation.TILDE;
					break;
				case "<-":
					if (isKeyword(peek(1), "chan")) {
						return parsePrimary(parseTypeLiteral(), first);
					}
					operation = GoUnary.Operation.RECV;
					break;
				default:
					break;
			}
			if (operation != null) {
				next();
				return located(new GoUnary(operation, parseUnary()), first);
			}
		}
		return parsePrimary(parseOperand(), first);
	}

	private GoExpression parseOperand() throws GoParseException {
		GoToken first = peek();
		switch (first.getType()) {
			case IDENT:
				next();
				return located(new GoVariableName(first.getValue()), first);
			case INT:
				next();
				return located(new GoIntLiteral(first.getValue()), first);
			case FLOAT:
				next();
				return located(new GoFloatLiteral(first.getValue()), first);
			case IMAG:
				next();
				return located(new GoImaginaryLiteral(first.getValue()), first);
			case CHAR:
				next();
				return located(new GoRuneLiteral(first.getValue()), first);
			case STRING:
				next();
				return located(new GoStringLiteral(first.getValue()), first);
			default:
				break;
		}
		if (isOp(first, "(")) {
			next();
			int oldExprLev = exprLev;
			exprLev++;
			GoExpression inner = parseExpression();
			exprLev = oldExprLev;
			expectOp(")");
			return located(new GoParenthesized(inner), first);
		}
		if (isKeyword(first, "func")) {
			next();
			GoFuncType type = parseSignature(Collections.emptyList(), first);
			if (atOp("{")) {
				int oldExprLev = exprLev;
				exprLev = 0;
				GoBlock body = parseBlock();
				exprLev = oldExprLev;
				return located(new GoAnonymousFunction(type, body), first);
			}
			return type;
		}
		GoExpression type = parseTypeLiteral();
		if (type != null) {
			return type;
		}
		throw error("expression");
	}

	private static GoExpression unparen(GoExpression x) {
		while (x instanceof GoParenthesized) {
			x = ((GoParenthesized) x).getInner();
		}
		return x;
	}

	/**
	 * Decides whether a "{" following x opens a composite literal of type x
	 */
	private boolean isCompositeLiteralType(GoExpression x) {
		GoExpression t = unparen(x);
		if (t instanceof GoVariableName || t instanceof GoSelectorExpression || t instanceof GoIndexExpression ||
				t instanceof GoTypeName) {
			return exprLev >= 0;
		}
		return t instanceof GoArrayType || t instanceof GoStructType || t instanceof GoMapType;
	}

	private GoExpression parsePrimary(GoExpression x, GoToken first) throws GoParseException {
		while (true) {
			GoToken t = peek();
			if (isOp(t, ".")) {
				next();
				if (acceptOp("(")) {
					GoExpression type = null;
					if (atKeyword("type")) {
						next();
					} else {
						type = parseType();
					}
					expectOp(")");
					x = located(new GoTypeAssertion(x, type), first);
				} else {
					x = located(new GoSelectorExpression(x, expectIdent()), first);
				}
			} else if (isOp(t, "[")) {
				next();
				x = parseIndexOrSlice(x, first);
			} else if (isOp(t, "(")) {
				next();
				int oldExprLev = exprLev;
				exprLev++;
				List<GoExpression> arguments = new ArrayList<>();
				boolean ellipsis = false;
				while (!atOp(")")) {
					arguments.add(parseExpression());
					if (acceptOp("...")) {
						ellipsis = true;
					}
					if (!acceptOp(",")) {
						break;
					}
				}
				exprLev = oldExprLev;
				expectOp(")");
				x = located(new GoCall(x, arguments, ellipsis), first);
			} else if (isOp(t, "{") && isCompositeLiteralType(x)) {
				x = parseLiteralValue(x, first);
			} else {
				return x;
			}
		}
	}

	private GoExpression parseIndexOrSlice(GoExpression x, GoToken first) throws GoParseException {
		int oldExprLev = exprLev;
		exprLev++;
		GoExpression[] bounds = new GoExpression[3];
		int colons = 0;
		if (!atOp(":")) {
			bounds[0] = parseExpression();
		}
		List<GoExpression> indices = null;
		if (atOp(",")) {
			indices = new ArrayList<>();
			indices.add(bounds[0]);
			while (acceptOp(",")) {
				if (atOp("]")) {
					break;
				}
				indices.add(parseExpression());
			}
		} else {
			while (colons < 2 && acceptOp(":")) {
				++colons;
				if (!atOp(":") && !atOp("]")) {
					bounds[colons] = parseExpression();
				}
			}
		}
		exprLev = oldExprLev;
		expectOp("]");
		if (indices != null) {
			return located(new GoIndexExpression(x, indices), first);
		}
		if (colons == 0) {
			if (bounds[0] == null) {
				throw error("operand");
			}
			List<GoExpression> single = new ArrayList<>();
			single.add(bounds[0]);
			return located(new GoIndexExpression(x, single), first);
		}
		boolean slice3 = colons == 2;
		if (slice3 && (bounds[1] == null || bounds[2] == null)) {
			throw new GoParseException("middle and final index required in 3-index slice", previous().getLocation());
		}
		return located(new GoSliceOperator(x, bounds[0], bounds[1], bounds[2], slice3), first);
	}

	private GoCompositeLiteral parseLiteralValue(GoExpression type, GoToken first) throws GoParseException {
		expectOp("{");
		int oldExprLev = exprLev;
		exprLev++;
		List<GoExpression> elements = new ArrayList<>();
		while (!atOp("}")) {
			GoToken elementStart = peek();
			GoExpression element = parseElement();
			if (acceptOp(":")) {
				element = located(new GoKeyValue(element, parseElement()), elementStart);
			}
			elements.add(element);
			if (!acceptOp(",")) {
				break;
			}
		}
		exprLev = oldExprLev;
		if (atSemicolon() && peek().getValue().equals("\n")) {
			throw new GoParseException("missing ',' before newline in composite literal", peek().getLocation());
		}
		expectOp("}");
		return located(new GoCompositeLiteral(type, elements), first);
	}

	private GoExpression parseElement() throws GoParseException {
		if (atOp("{")) {
			return parseLiteralValue(null, peek());
		}
		return parseExpression();
	}

}
