package gotry.model.golang.type;

import gotry.model.golang.GoExpression;

import java.util.Objects;

public class GoChanType extends GoType {

	public enum Direction {
		BOTH,
		SEND,
		RECV,
	}

	private final Direction direction;
	private final GoExpression elementType;

	public GoChanType(Direction direction, GoExpression elementType) {
		this.direction = direction;
		this.elementType = elementType;
	}

	public Direction getDirection() {
		return direction;
	}

	public GoExpression getElementType() {
		return elementType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoChanType chanType = (GoChanType) o;
		return direction == chanType.direction &&
				Objects.equals(elementType, chanType.elementType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(direction, elementType);
	}

}
