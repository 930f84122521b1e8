package gotry.model.golang.type;

import gotry.model.golang.GoExpression;

import java.util.Objects;

/**
 * [N]T, [...]T, or the slice type []T when the length is absent
 */
public class GoArrayType extends GoType {

	private final GoExpression length;
	private final GoExpression elementType;

	public GoArrayType(GoExpression length, GoExpression elementType) {
		this.length = length;
		this.elementType = elementType;
	}

	/**
	 * @return the length expression, a {@link gotry.model.golang.GoEllipsis} for [...]T, or null for a slice
	 */
	public GoExpression getLength() {
		return length;
	}

	public GoExpression getElementType() {
		return elementType;
	}

	public boolean isSlice() {
		return length == null;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoArrayType that = (GoArrayType) o;
		return Objects.equals(length, that.length) &&
				Objects.equals(elementType, that.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(length, elementType);
	}

}
