package gotry.model.golang;

import java.util.Objects;

/**
 * defer f(x)
 */
public class GoDefer extends GoStatement {

	private final GoExpression call;

	public GoDefer(GoExpression call) {
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
		GoDefer that = (GoDefer) o;
		return Objects.equals(call, that.call);
	}

	@Override
	public int hashCode() {

		return Objects.hash(call);
	}
}
