package gotry.model.golang;

import java.util.Objects;

public class GoKeyValue extends GoExpression {

	private final GoExpression key;
	private final GoExpression value;

	public GoKeyValue(GoExpression key, GoExpression value) {
		this.key = key;
		this.value = value;
	}

	public GoExpression getKey() {
		return key;
	}

	public GoExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoKeyValue that = (GoKeyValue) o;
		return Objects.equals(key, that.key) &&
				Objects.equals(value, that.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, value);
	}
}
