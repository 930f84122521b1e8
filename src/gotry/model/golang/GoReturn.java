package gotry.model.golang;

import java.util.List;
import java.util.Objects;

public class GoReturn extends GoStatement {

	private final List<GoExpression> values;

	public GoReturn(List<GoExpression> values) {
		this.values = values;
	}

	/**
	 * @return the returned expressions, empty for a naked return
	 */
	public List<GoExpression> getValues() {
		return values;
	}

	public boolean isNaked() {
		return values.isEmpty();
	}

	/**
	 * @return the last returned expression, or null for a naked return
	 */
	public GoExpression getLastValue() {
		if (isNaked()) {
			return null;
		}
		return values.get(values.size() - 1);
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoReturn goReturn = (GoReturn) o;
		return Objects.equals(values, goReturn.values);
	}

	@Override
	public int hashCode() {

		return Objects.hash(values);
	}
}
