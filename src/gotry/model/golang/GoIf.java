package gotry.model.golang;

import java.util.Objects;

/**
 * The if statement
 *
 */
public class GoIf extends GoStatement {
	private GoStatement init;
	// boolean condition
	private final GoExpression cond;
	private final GoBlock bThen;
	private final GoStatement bElse;

	public GoIf(GoStatement init, GoExpression cond, GoBlock bThen, GoStatement bElse) {
		this.init = init;
		this.cond = cond;
		this.bThen = bThen;
		this.bElse = bElse;
	}

	/**
	 * @return the simple statement before the condition, or null
	 */
	public GoStatement getInit() {
		return init;
	}

	public void setInit(GoStatement init) {
		this.init = init;
	}

	public GoExpression getCond() {
		return cond;
	}

	public GoBlock getThen() {
		return bThen;
	}

	/**
	 * @return null, a {@link GoBlock}, or the {@link GoIf} of an else-if chain
	 */
	public GoStatement getElse() {
		return bElse;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIf anIf = (GoIf) o;
		return Objects.equals(init, anIf.init) &&
				Objects.equals(cond, anIf.cond) &&
				Objects.equals(bThen, anIf.bThen) &&
				Objects.equals(bElse, anIf.bElse);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, cond, bThen, bElse);
	}
}
