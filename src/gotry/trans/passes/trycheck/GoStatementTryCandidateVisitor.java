package gotry.trans.passes.trycheck;

import gotry.model.golang.*;
import gotry.stats.StatKind;
import gotry.stats.Stats;

import java.util.List;
import java.util.Objects;

/**
 * Walks the statements of one function body, descending into nested statement lists but never into expressions,
 * so function literals are never examined. Each if statement is matched after its own sub-blocks are walked.
 */
public class GoStatementTryCandidateVisitor extends GoStatementVisitor<Void, RuntimeException> {

	private static final String DEFAULT_ERROR_NAME = "err";

	private final TryCandidateOptions options;
	private final Stats stats;
	private final FunctionState state;

	public GoStatementTryCandidateVisitor(TryCandidateOptions options, Stats stats, FunctionState state) {
		this.options = options;
		this.stats = stats;
		this.state = state;
	}

	public void walkStatements(List<GoStatement> statements) {
		GoStatement previous = null;
		for (int i = 0; i < statements.size(); ++i) {
			GoStatement statement = statements.get(i);
			stats.count(StatKind.STMT, statement.getLocation());
			statement.accept(this);
			if (statement instanceof GoIf) {
				stats.count(StatKind.IF, statement.getLocation());
				checkIf((GoIf) statement, previous, statements, i);
			}
			previous = statement;
		}
		statements.removeIf(Objects::isNull);
	}

	private void checkIf(GoIf goIf, GoStatement previous, List<GoStatement> statements, int index) {
		ErrorCheckMatch match = ErrorCheckMatcher.match(goIf, previous, options);
		if (match.getOutcome() == ErrorCheckMatch.Outcome.NOT_ERROR_TEST) {
			return;
		}
		stats.count(StatKind.IF_ERR, goIf.getLocation());
		if (!match.getErrorName().equals(DEFAULT_ERROR_NAME)) {
			stats.count(StatKind.NON_ERR_NAME, goIf.getLocation());
		}
		state.getSharedReturns().record(match);

		StatKind kind = match.getOutcome().getStatKind();
		if (match.isCandidate()) {
			stats.count(kind, match.isInitForm() ? goIf.getLocation() : match.getAssignment().getLocation());
			if (options.isRewrite()) {
				TryRewriter.rewrite(match, statements, index, state);
			}
		} else if (kind != null) {
			stats.count(kind, goIf.getLocation());
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
		walkStatements(block.getStatements());
		return null;
	}

	@Override
	public Void visit(GoFor goFor) throws RuntimeException {
		walkStatements(goFor.getBody().getStatements());
		return null;
	}

	@Override
	public Void visit(GoForRange forRange) throws RuntimeException {
		walkStatements(forRange.getBody().getStatements());
		return null;
	}

	@Override
	public Void visit(GoIf goIf) throws RuntimeException {
		walkStatements(goIf.getThen().getStatements());
		// an else if is not walked
		if (goIf.getElse() instanceof GoBlock) {
			walkStatements(((GoBlock) goIf.getElse()).getStatements());
		}
		return null;
	}

	@Override
	public Void visit(GoSwitch goSwitch) throws RuntimeException {
		for (GoSwitchCase switchCase : goSwitch.getCases()) {
			walkStatements(switchCase.getBlock());
		}
		return null;
	}

	@Override
	public Void visit(GoTypeSwitch typeSwitch) throws RuntimeException {
		for (GoSwitchCase switchCase : typeSwitch.getCases()) {
			walkStatements(switchCase.getBlock());
		}
		return null;
	}

	@Override
	public Void visit(GoLabeledStatement labeledStatement) throws RuntimeException {
		return null;
	}

	@Override
	public Void visit(GoSelect select) throws RuntimeException {
		for (GoSelectCase selectCase : select.getCases()) {
			walkStatements(selectCase.getBlock());
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
