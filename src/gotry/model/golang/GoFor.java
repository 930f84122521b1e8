package gotry.model.golang;

import java.util.Objects;

/**
 * for init; cond; inc { body }, any of init, cond and inc possibly null
 */
public class GoFor extends GoStatement {

	private final GoStatement init;
	private final GoExpression condition;
	private final GoStatement increment;
	private final GoBlock body;

	public GoFor(GoStatement init, GoExpression condition, GoStatement increment, GoBlock body) {
		this.init = init;
		this.condition = condition;
		this.increment = increment;
		this.body = body;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoExpression getCondition() {
		return condition;
	}

	public GoStatement getIncrement() {
		return increment;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFor goFor = (GoFor) o;
		return Objects.equals(init, goFor.init) &&
				Objects.equals(condition, goFor.condition) &&
				Objects.equals(increment, goFor.increment) &&
				Objects.equals(body, goFor.body);
	}

	@Override
	public int hashCode() {

		return Objects.hash(init, condition, increment, body);
	}
}
