package gotry.model.golang;

import java.util.Objects;

/**
 * "...T" in a variadic parameter list, or the bare "..." length of an array literal type
 */
public class GoEllipsis extends GoExpression {

	private final GoExpression elementType;

	public GoEllipsis(GoExpression elementType) {
		this.elementType = elementType;
	}

	/**
	 * @return the element type, or null when used as an array length
	 */
	public GoExpression getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoEllipsis that = (GoEllipsis) o;
		return Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elementType);
	}
}
