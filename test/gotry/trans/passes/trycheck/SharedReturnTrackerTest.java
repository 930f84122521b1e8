package gotry.trans.passes.trycheck;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import gotry.model.golang.GoExpression;
import gotry.parser.GoParseException;

public class SharedReturnTrackerTest {

	private static ErrorCheckMatch match(ErrorCheckMatch.Outcome outcome, String trailing) throws GoParseException {
		GoExpression expression = trailing == null ? null : TryCheckTestingUtils.expr(trailing);
		return new ErrorCheckMatch(outcome, null, "err", expression, null, false);
	}

	@Test
	public void nothingSharedWithFewerThanTwo() throws GoParseException {
		SharedReturnTracker tracker = new SharedReturnTracker();
		assertThat(tracker.getShared().isEmpty(), is(true));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		assertThat(tracker.getShared().isEmpty(), is(true));
		assertThat(tracker.isInvalidated(), is(false));
	}

	@Test
	public void equalExpressionsAreShared() throws GoParseException {
		SharedReturnTracker tracker = new SharedReturnTracker();
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "fmt.Errorf(\"f: %v\", err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "fmt.Errorf(\"f: %v\", err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "fmt.Errorf(\"f: %v\", err)"));
		List<GoExpression> shared = tracker.getShared();
		assertThat(shared.size(), is(3));
	}

	@Test
	public void differentExpressionInvalidates() throws GoParseException {
		SharedReturnTracker tracker = new SharedReturnTracker();
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "other(err)"));
		assertThat(tracker.isInvalidated(), is(true));
		assertThat(tracker.getShared().isEmpty(), is(true));

		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		assertThat(tracker.getShared().isEmpty(), is(true));
	}

	@Test
	public void otherCheckedReturnsInvalidate() throws GoParseException {
		for (ErrorCheckMatch.Outcome outcome : new ErrorCheckMatch.Outcome[]{
				ErrorCheckMatch.Outcome.CANDIDATE,
				ErrorCheckMatch.Outcome.NON_ZERO_RESULTS,
				ErrorCheckMatch.Outcome.HAS_ELSE,
				ErrorCheckMatch.Outcome.NOT_ASSIGNMENT}) {
			SharedReturnTracker tracker = new SharedReturnTracker();
			tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
			tracker.record(match(outcome, "err"));
			tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
			assertThat(outcome.toString(), tracker.isInvalidated(), is(true));
		}
	}

	@Test
	public void handlersWithoutAReturnAreIgnored() throws GoParseException {
		SharedReturnTracker tracker = new SharedReturnTracker();
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		tracker.record(match(ErrorCheckMatch.Outcome.SINGLE_STMT_HANDLER, null));
		tracker.record(match(ErrorCheckMatch.Outcome.MULTI_STMT_HANDLER, null));
		tracker.record(match(ErrorCheckMatch.Outcome.NOT_ERROR_TEST, null));
		tracker.record(match(ErrorCheckMatch.Outcome.RETURN_EXPR, "wrap(err)"));
		assertThat(tracker.isInvalidated(), is(false));
		assertThat(tracker.getShared().size(), is(2));
	}

}
