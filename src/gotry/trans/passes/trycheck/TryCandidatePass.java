package gotry.trans.passes.trycheck;

import gotry.model.golang.GoDeclaration;
import gotry.model.golang.GoExpression;
import gotry.model.golang.GoField;
import gotry.model.golang.GoFunctionDeclaration;
import gotry.model.golang.GoModule;
import gotry.model.golang.type.GoTypeName;
import gotry.stats.StatKind;
import gotry.stats.Stats;

import java.util.List;

public class TryCandidatePass {

	private TryCandidatePass() {}

	static boolean returnsError(GoFunctionDeclaration fn, String errorTypeName) {
		List<GoField> results = fn.getResults();
		if (results.isEmpty()) {
			return false;
		}
		GoExpression last = results.get(results.size() - 1).getType();
		return last instanceof GoTypeName && ((GoTypeName) last).isUnqualified(errorTypeName);
	}

	/**
	 * Classifies, and with options.isRewrite() collapses, the error checks of every top-level function of module
	 * returning an error.
	 *
	 * @return whether module was modified
	 */
	public static boolean perform(GoModule module, TryCandidateOptions options, Stats stats) {
		boolean modified = false;
		for (GoDeclaration declaration : module.getDeclarations()) {
			if (!(declaration instanceof GoFunctionDeclaration)) {
				continue;
			}
			GoFunctionDeclaration fn = (GoFunctionDeclaration) declaration;
			stats.count(StatKind.FUNC, fn.getLocation());
			if (fn.getBody() == null || !returnsError(fn, options.getErrorTypeName())) {
				continue;
			}
			stats.count(StatKind.FUNC_ERROR, fn.getLocation());

			FunctionState state = new FunctionState();
			new GoStatementTryCandidateVisitor(options, stats, state).walkStatements(fn.getBody().getStatements());
			for (GoExpression shared : state.getSharedReturns().getShared()) {
				stats.count(StatKind.SHARED_RETURN, shared.getLocation());
			}
			if (state.isModified()) {
				modified = true;
			}
		}
		return modified;
	}
}
