package gotry.trans.passes.trycheck;

import gotry.model.golang.GoExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tracks, within one function, whether every error handler that failed to match returns the same non-error
 * trailing expression (for instance the same wrapping call). Such functions could share one wrapper.
 */
public class SharedReturnTracker {

	private final List<GoExpression> captured = new ArrayList<>();
	private boolean invalidated = false;

	public void record(ErrorCheckMatch match) {
		if (invalidated || !match.getOutcome().isReturnChecked()) {
			return;
		}
		if (match.getOutcome() != ErrorCheckMatch.Outcome.RETURN_EXPR) {
			invalidate();
			return;
		}
		GoExpression trailing = match.getTrailingExpression();
		if (captured.isEmpty() || GoExpressionStructuralEqualityVisitor.equal(captured.get(0), trailing)) {
			captured.add(trailing);
		} else {
			invalidate();
		}
	}

	private void invalidate() {
		invalidated = true;
		captured.clear();
	}

	public boolean isInvalidated() {
		return invalidated;
	}

	/**
	 * @return the captured expressions if there are at least two of them and none differed, otherwise nothing
	 */
	public List<GoExpression> getShared() {
		if (invalidated || captured.size() < 2) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(captured);
	}
}
