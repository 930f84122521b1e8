package gotry.model.golang;

import java.util.List;
import java.util.Objects;

public class GoTypeSwitch extends GoStatement {

	private final GoStatement init;
	private final GoStatement assign;
	private final List<GoSwitchCase> cases;

	/**
	 * @param assign the guard, either "x := y.(type)" or the expression statement "y.(type)"
	 */
	public GoTypeSwitch(GoStatement init, GoStatement assign, List<GoSwitchCase> cases) {
		this.init = init;
		this.assign = assign;
		this.cases = cases;
	}

	public GoStatement getInit() {
		return init;
	}

	public GoStatement getAssign() {
		return assign;
	}

	public List<GoSwitchCase> getCases() {
		return cases;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeSwitch that = (GoTypeSwitch) o;
		return Objects.equals(init, that.init) &&
				Objects.equals(assign, that.assign) &&
				Objects.equals(cases, that.cases);
	}

	@Override
	public int hashCode() {
		return Objects.hash(init, assign, cases);
	}
}
