package gotry.model.golang;

import java.util.Objects;

public class GoIncDec extends GoStatement {

	private final boolean inc;
	private final GoExpression target;

	public GoIncDec(boolean inc, GoExpression target) {
		this.inc = inc;
		this.target = target;
	}

	public boolean isInc() {
		return inc;
	}

	public GoExpression getTarget() {
		return target;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIncDec incDec = (GoIncDec) o;
		return inc == incDec.inc &&
				Objects.equals(target, incDec.target);
	}

	@Override
	public int hashCode() {

		return Objects.hash(inc, target);
	}
}
