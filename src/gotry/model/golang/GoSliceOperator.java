package gotry.model.golang;

import java.util.Objects;

public class GoSliceOperator extends GoExpression {

	private final GoExpression target;
	private final GoExpression low;
	private final GoExpression high;
	private final GoExpression max;
	private final boolean slice3;

	public GoSliceOperator(GoExpression target, GoExpression low, GoExpression high, GoExpression max,
	                       boolean slice3) {
		this.target = target;
		this.low = low;
		this.high = high;
		this.max = max;
		this.slice3 = slice3;
	}

	public GoExpression getTarget() {
		return target;
	}

	public GoExpression getLow() {
		return low;
	}

	public GoExpression getHigh() {
		return high;
	}

	public GoExpression getMax() {
		return max;
	}

	/**
	 * @return whether this is a three-index slice a[low:high:max]
	 */
	public boolean isSlice3() {
		return slice3;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSliceOperator that = (GoSliceOperator) o;
		return slice3 == that.slice3 &&
				Objects.equals(target, that.target) &&
				Objects.equals(low, that.low) &&
				Objects.equals(high, that.high) &&
				Objects.equals(max, that.max);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, low, high, max, slice3);
	}
}
