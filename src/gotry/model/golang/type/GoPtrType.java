package gotry.model.golang.type;

import gotry.model.golang.GoExpression;

import java.util.Objects;

public class GoPtrType extends GoType {

	private final GoExpression pointee;

	public GoPtrType(GoExpression pointee) {
		this.pointee = pointee;
	}

	public GoExpression getPointee() {
		return pointee;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoPtrType ptrType = (GoPtrType) o;
		return Objects.equals(pointee, ptrType.pointee);
	}

	@Override
	public int hashCode() {
		return Objects.hash(pointee);
	}

}
