package gotry.trans.passes.trycheck;

import gotry.model.golang.*;

import java.util.List;
import java.util.Optional;

/**
 * Matches an if statement, together with the assignment it checks, against
 *
 * <pre>
 *     v1, ..., vn, err := f()        // or =
 *     if err != nil {
 *         return z1, ..., zm, err    // zi zero values, or a naked return
 *     }
 * </pre>
 *
 * or the same with the assignment as the if statement's initializer.
 */
public final class ErrorCheckMatcher {

	private static final GoExpressionIsZeroVisitor IS_ZERO = new GoExpressionIsZeroVisitor();

	private ErrorCheckMatcher() {}

	/**
	 * @return the name tested by a condition of the form "name != nil", if it is acceptable under options
	 */
	public static Optional<String> errorTestName(GoExpression cond, TryCandidateOptions options) {
		if (!(cond instanceof GoBinop)) {
			return Optional.empty();
		}
		GoBinop binop = (GoBinop) cond;
		if (binop.getOperation() != GoBinop.Operation.NEQ || !isName(binop.getRHS(), GoBuiltins.NIL) ||
				!(binop.getLHS() instanceof GoVariableName)) {
			return Optional.empty();
		}
		String name = ((GoVariableName) binop.getLHS()).getName();
		if (!options.acceptsAnyErrorVariableName() && !name.equals(options.getErrorVariableName())) {
			return Optional.empty();
		}
		return Optional.of(name);
	}

	static boolean isName(GoExpression expression, String name) {
		return expression instanceof GoVariableName && ((GoVariableName) expression).isNamed(name);
	}

	/**
	 * @return whether statement assigns the result of a single call, the last target being errorName
	 */
	public static boolean isErrorAssignment(GoStatement statement, String errorName) {
		if (!(statement instanceof GoAssignmentStatement)) {
			return false;
		}
		GoAssignmentStatement assignment = (GoAssignmentStatement) statement;
		List<GoExpression> names = assignment.getNames();
		return !names.isEmpty() && isName(names.get(names.size() - 1), errorName) &&
				assignment.getValues().size() == 1 && assignment.getValues().get(0) instanceof GoCall;
	}

	/**
	 * @param previous the statement preceding goIf in its list, or null; ignored when goIf has an initializer
	 */
	public static ErrorCheckMatch match(GoIf goIf, GoStatement previous, TryCandidateOptions options) {
		Optional<String> testName = errorTestName(goIf.getCond(), options);
		if (!testName.isPresent()) {
			return ErrorCheckMatch.notErrorTest(goIf);
		}
		String errorName = testName.get();

		List<GoStatement> handler = goIf.getThen().getStatements();
		if (handler.size() != 1) {
			return rejected(ErrorCheckMatch.Outcome.MULTI_STMT_HANDLER, goIf, errorName, null);
		}
		if (!(handler.get(0) instanceof GoReturn)) {
			return rejected(ErrorCheckMatch.Outcome.SINGLE_STMT_HANDLER, goIf, errorName, null);
		}

		GoReturn goReturn = (GoReturn) handler.get(0);
		List<GoExpression> results = goReturn.getValues();
		GoExpression trailing = goReturn.getLastValue();
		if (!goReturn.isNaked()) {
			if (!isName(trailing, errorName)) {
				return rejected(ErrorCheckMatch.Outcome.RETURN_EXPR, goIf, errorName, trailing);
			}
			for (GoExpression result : results.subList(0, results.size() - 1)) {
				if (!result.accept(IS_ZERO)) {
					return rejected(ErrorCheckMatch.Outcome.NON_ZERO_RESULTS, goIf, errorName, trailing);
				}
			}
		}

		if (goIf.getElse() != null) {
			return rejected(ErrorCheckMatch.Outcome.HAS_ELSE, goIf, errorName, trailing);
		}

		boolean initForm = goIf.getInit() != null;
		GoStatement candidate = initForm ? goIf.getInit() : previous;
		if (!isErrorAssignment(candidate, errorName)) {
			return rejected(ErrorCheckMatch.Outcome.NOT_ASSIGNMENT, goIf, errorName, trailing);
		}
		return new ErrorCheckMatch(ErrorCheckMatch.Outcome.CANDIDATE, goIf, errorName, trailing,
				(GoAssignmentStatement) candidate, initForm);
	}

	private static ErrorCheckMatch rejected(ErrorCheckMatch.Outcome outcome, GoIf goIf, String errorName,
	                                        GoExpression trailing) {
		return new ErrorCheckMatch(outcome, goIf, errorName, trailing, null, false);
	}
}
