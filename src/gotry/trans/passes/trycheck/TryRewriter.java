package gotry.trans.passes.trycheck;

import gotry.InternalToolError;
import gotry.model.golang.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collapses an accepted error check into a call to the try builtin.
 */
public final class TryRewriter {

	private TryRewriter() {}

	private static boolean isBlanks(List<GoExpression> names) {
		return names.stream().allMatch(name -> name instanceof GoVariableName && ((GoVariableName) name).isBlank());
	}

	/**
	 * @return the statement replacing assignment, its single call wrapped in try and its last target dropped
	 */
	static GoStatement collapse(GoAssignmentStatement assignment, GoIf goIf) {
		GoCall call = (GoCall) assignment.getValues().get(0);
		GoCall tryCall = new GoCall(GoBuiltins.Try, Collections.singletonList(call));
		tryCall.setLocation(call.getLocation().combine(goIf.getLocation()));

		List<GoExpression> names = assignment.getNames();
		List<GoExpression> remaining = new ArrayList<>(names.subList(0, names.size() - 1));
		if (isBlanks(remaining)) {
			return new GoExpressionStatement(tryCall);
		}
		return new GoAssignmentStatement(remaining, assignment.isDefinition(), Collections.singletonList(tryCall));
	}

	/**
	 * Rewrites match, whose if statement is at ifIndex in statements.
	 *
	 * In the separate form the assignment's slot receives the collapsed statement and the if statement's slot is
	 * set to null, to be compacted by the caller. In the initializer form only the initializer is replaced.
	 */
	public static void rewrite(ErrorCheckMatch match, List<GoStatement> statements, int ifIndex,
	                           FunctionState state) {
		if (!match.isCandidate()) {
			throw new InternalToolError("rewriting an error check that is not a try candidate: " +
					match.getOutcome());
		}
		GoIf goIf = match.getIf();
		GoAssignmentStatement assignment = match.getAssignment();
		if (statements.get(ifIndex) != goIf || !ErrorCheckMatcher.isErrorAssignment(assignment, match.getErrorName())) {
			throw new InternalToolError("try candidate does not match the statements being rewritten");
		}
		GoStatement replacement = collapse(assignment, goIf);
		if (match.isInitForm()) {
			if (goIf.getInit() != assignment) {
				throw new InternalToolError("try candidate is not the initializer of its if statement");
			}
			replacement.setLocation(assignment.getLocation());
			goIf.setInit(replacement);
		} else {
			if (ifIndex == 0 || statements.get(ifIndex - 1) != assignment) {
				throw new InternalToolError("try candidate does not precede its if statement");
			}
			replacement.setLocation(assignment.getLocation().combine(goIf.getLocation()));
			statements.set(ifIndex - 1, replacement);
			statements.set(ifIndex, null);
		}
		state.markModified();
	}
}
