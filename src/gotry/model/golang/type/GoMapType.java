package gotry.model.golang.type;

import gotry.model.golang.GoExpression;

import java.util.Objects;

public class GoMapType extends GoType {

	private final GoExpression keyType;
	private final GoExpression valueType;

	public GoMapType(GoExpression keyType, GoExpression valueType) {
		this.keyType = keyType;
		this.valueType = valueType;
	}

	public GoExpression getKeyType() {
		return keyType;
	}

	public GoExpression getValueType() {
		return valueType;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoMapType mapType = (GoMapType) o;
		return Objects.equals(keyType, mapType.keyType) &&
				Objects.equals(valueType, mapType.valueType);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyType, valueType);
	}

}
