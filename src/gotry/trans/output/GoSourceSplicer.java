package gotry.trans.output;

import gotry.model.golang.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies the statements produced by the try rewrite back onto the source text they were parsed from. Only the
 * ranges of rewritten statements change, so comments and formatting elsewhere survive byte for byte.
 */
public class GoSourceSplicer {

	private GoSourceSplicer() {}

	private static final class Edit {
		final int start;
		final int end;
		final String text;

		Edit(int start, int end, String text) {
			this.start = start;
			this.end = end;
			this.text = text;
		}
	}

	public static String splice(String source, GoModule module) {
		List<Edit> edits = new ArrayList<>();
		TryStatementCollector collector = new TryStatementCollector(source, edits);
		for (GoDeclaration declaration : module.getDeclarations()) {
			if (declaration instanceof GoFunctionDeclaration && ((GoFunctionDeclaration) declaration).getBody() != null) {
				((GoFunctionDeclaration) declaration).getBody().accept(collector);
			}
		}
		edits.sort(Comparator.comparingInt((Edit e) -> e.start).reversed());
		StringBuilder result = new StringBuilder(source);
		int limit = source.length();
		for (Edit edit : edits) {
			// statements never overlap; an edit reaching past the previous one means the tree is inconsistent
			if (edit.end > limit) {
				throw new IllegalStateException("overlapping rewrites at offset " + edit.start);
			}
			result.replace(edit.start, edit.end, edit.text);
			limit = edit.start;
		}
		return result.toString();
	}

	/**
	 * @return the source text of node, or its formatted text if it was not parsed from source
	 */
	static String text(String source, GoNode node) {
		if (node.getLocation().isUnknown()) {
			return node.toString();
		}
		return source.substring(node.getLocation().getStartOffset(), node.getLocation().getEndOffset());
	}

	/**
	 * @return the new text of a statement whose value is a try call, reusing the source text of its parts
	 */
	static String tryStatementText(String source, GoStatement statement) {
		StringBuilder out = new StringBuilder();
		GoExpression tryCall;
		if (statement instanceof GoAssignmentStatement) {
			GoAssignmentStatement assignment = (GoAssignmentStatement) statement;
			List<GoExpression> names = assignment.getNames();
			for (int i = 0; i < names.size(); ++i) {
				if (i > 0) {
					out.append(", ");
				}
				out.append(text(source, names.get(i)));
			}
			out.append(assignment.isDefinition() ? " := " : " = ");
			tryCall = assignment.getValues().get(0);
		} else {
			tryCall = ((GoExpressionStatement) statement).getExpression();
		}
		GoCall call = (GoCall) tryCall;
		out.append(((GoBuiltins.BuiltinConstant) call.getTarget()).getValue());
		out.append('(');
		out.append(text(source, call.getArguments().get(0)));
		out.append(')');
		return out.toString();
	}

	static boolean isTryStatement(GoStatement statement) {
		if (statement instanceof GoExpressionStatement) {
			return GoBuiltins.isTry(((GoExpressionStatement) statement).getExpression());
		}
		if (statement instanceof GoAssignmentStatement) {
			List<GoExpression> values = ((GoAssignmentStatement) statement).getValues();
			return values.size() == 1 && GoBuiltins.isTry(values.get(0));
		}
		return false;
	}

	private static class TryStatementCollector extends GoStatementVisitor<Void, RuntimeException> {
		private final String source;
		private final List<Edit> edits;

		TryStatementCollector(String source, List<Edit> edits) {
			this.source = source;
			this.edits = edits;
		}

		private void collect(GoStatement statement) {
			if (statement == null) {
				return;
			}
			if (isTryStatement(statement)) {
				edits.add(new Edit(statement.getLocation().getStartOffset(), statement.getLocation().getEndOffset(),
						tryStatementText(source, statement)));
			} else {
				statement.accept(this);
			}
		}

		private void collectAll(List<GoStatement> statements) {
			for (GoStatement statement : statements) {
				collect(statement);
			}
		}

		@Override
		public Void visit(GoAssignmentStatement assignment) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoOperatorAssignment operatorAssignment) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoReturn goReturn) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoBlock block) throws RuntimeException {
			collectAll(block.getStatements());
			return null;
		}

		@Override
		public Void visit(GoFor goFor) throws RuntimeException {
			collectAll(goFor.getBody().getStatements());
			return null;
		}

		@Override
		public Void visit(GoForRange forRange) throws RuntimeException {
			collectAll(forRange.getBody().getStatements());
			return null;
		}

		@Override
		public Void visit(GoIf goIf) throws RuntimeException {
			collect(goIf.getInit());
			collectAll(goIf.getThen().getStatements());
			collect(goIf.getElse());
			return null;
		}

		@Override
		public Void visit(GoSwitch goSwitch) throws RuntimeException {
			for (GoSwitchCase switchCase : goSwitch.getCases()) {
				collectAll(switchCase.getBlock());
			}
			return null;
		}

		@Override
		public Void visit(GoTypeSwitch typeSwitch) throws RuntimeException {
			for (GoSwitchCase switchCase : typeSwitch.getCases()) {
				collectAll(switchCase.getBlock());
			}
			return null;
		}

		@Override
		public Void visit(GoLabeledStatement labeledStatement) throws RuntimeException {
			collect(labeledStatement.getStatement());
			return null;
		}

		@Override
		public Void visit(GoSelect select) throws RuntimeException {
			for (GoSelectCase selectCase : select.getCases()) {
				collectAll(selectCase.getBlock());
			}
			return null;
		}

		@Override
		public Void visit(GoTo goTo) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoIncDec incDec) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoExpressionStatement expressionStatement) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoSend send) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoBreak break1) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoContinue continue1) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoFallthrough fallthrough) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoDefer defer) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoRoutineStatement go) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoDeclarationStatement declarationStatement) throws RuntimeException {
			return null;
		}

		@Override
		public Void visit(GoEmptyStatement emptyStatement) throws RuntimeException {
			return null;
		}
	}
}
