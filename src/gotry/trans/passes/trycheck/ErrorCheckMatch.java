package gotry.trans.passes.trycheck;

import gotry.model.golang.GoAssignmentStatement;
import gotry.model.golang.GoExpression;
import gotry.model.golang.GoIf;
import gotry.stats.StatKind;

/**
 * The classification of one if statement against the error check idiom.
 */
public class ErrorCheckMatch {

	public enum Outcome {
		NOT_ERROR_TEST(null, false),
		SINGLE_STMT_HANDLER(StatKind.SINGLE_STMT_HANDLER, false),
		MULTI_STMT_HANDLER(StatKind.MULTI_STMT_HANDLER, false),
		RETURN_EXPR(StatKind.RETURN_EXPR, true),
		NON_ZERO_RESULTS(StatKind.NON_ZERO_RESULTS, true),
		HAS_ELSE(StatKind.HAS_ELSE, true),
		NOT_ASSIGNMENT(null, true),
		CANDIDATE(StatKind.TRY_CANDIDATE, true);

		private final StatKind statKind;
		private final boolean returnChecked;

		Outcome(StatKind statKind, boolean returnChecked) {
			this.statKind = statKind;
			this.returnChecked = returnChecked;
		}

		/**
		 * @return the bucket this outcome is counted under, or null if it is not counted
		 */
		public StatKind getStatKind() {
			return statKind;
		}

		/**
		 * @return whether the handler's return statement was examined before the outcome was decided
		 */
		public boolean isReturnChecked() {
			return returnChecked;
		}
	}

	private final Outcome outcome;
	private final GoIf goIf;
	private final String errorName;
	private final GoExpression trailingExpression;
	private final GoAssignmentStatement assignment;
	private final boolean initForm;

	ErrorCheckMatch(Outcome outcome, GoIf goIf, String errorName, GoExpression trailingExpression,
	                GoAssignmentStatement assignment, boolean initForm) {
		this.outcome = outcome;
		this.goIf = goIf;
		this.errorName = errorName;
		this.trailingExpression = trailingExpression;
		this.assignment = assignment;
		this.initForm = initForm;
	}

	static ErrorCheckMatch notErrorTest(GoIf goIf) {
		return new ErrorCheckMatch(Outcome.NOT_ERROR_TEST, goIf, null, null, null, false);
	}

	public Outcome getOutcome() {
		return outcome;
	}

	public boolean isCandidate() {
		return outcome == Outcome.CANDIDATE;
	}

	public GoIf getIf() {
		return goIf;
	}

	/**
	 * @return the name tested by the condition, or null if the condition is not an error test
	 */
	public String getErrorName() {
		return errorName;
	}

	/**
	 * @return the last result of the handler's return, or null for a naked return or if it was never examined
	 */
	public GoExpression getTrailingExpression() {
		return trailingExpression;
	}

	/**
	 * @return the assignment to collapse, only set for candidates
	 */
	public GoAssignmentStatement getAssignment() {
		return assignment;
	}

	/**
	 * @return whether the assignment is the if statement's own initializer
	 */
	public boolean isInitForm() {
		return initForm;
	}
}
