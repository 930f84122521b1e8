package gotry.model.golang;

import java.util.Objects;

/**
 * go f(x)
 */
public class GoRoutineStatement extends GoStatement {

	private final GoExpression call;

	public GoRoutineStatement(GoExpression call) {
		this.call = call;
	}

	public GoExpression getCall() {
		return call;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoRoutineStatement that = (GoRoutineStatement) o;
		return Objects.equals(call, that.call);
	}

	@Override
	public int hashCode() {

		return Objects.hash(call);
	}
}
