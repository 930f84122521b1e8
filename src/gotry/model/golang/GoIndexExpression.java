package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * a[i], or a generic instantiation f[int, string] when there is more than one index
 */
public class GoIndexExpression extends GoExpression {

	private final GoExpression target;
	private final List<GoExpression> indices;

	public GoIndexExpression(GoExpression target, List<GoExpression> indices) {
		this.target = target;
		this.indices = indices;
	}

	public GoExpression getTarget() {
		return target;
	}

	public List<GoExpression> getIndices() {
		return indices;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoIndexExpression that = (GoIndexExpression) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(indices, that.indices);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, indices);
	}
}
