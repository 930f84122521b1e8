package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * T{a, b, k: v}. The type is null for elided inner literals such as the elements of [][]int{{1}, {2}}.
 */
public class GoCompositeLiteral extends GoExpression {

	private final GoExpression type;
	private final List<GoExpression> elements;
	private final boolean incomplete;

	public GoCompositeLiteral(GoExpression type, List<GoExpression> elements) {
		this(type, elements, false);
	}

	public GoCompositeLiteral(GoExpression type, List<GoExpression> elements, boolean incomplete) {
		this.type = type;
		this.elements = elements;
		this.incomplete = incomplete;
	}

	public GoExpression getType() {
		return type;
	}

	public List<GoExpression> getElements() {
		return elements;
	}

	/**
	 * @return true when some elements were elided, so the element list does not describe the whole literal
	 */
	public boolean isIncomplete() {
		return incomplete;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoCompositeLiteral that = (GoCompositeLiteral) o;
		return incomplete == that.incomplete &&
				Objects.equals(type, that.type) &&
				Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, elements, incomplete);
	}
}
