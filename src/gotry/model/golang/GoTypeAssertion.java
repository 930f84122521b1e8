package gotry.model.golang;

import java.util.Objects;

public class GoTypeAssertion extends GoExpression {

	private final GoExpression target;
	private final GoExpression type;

	public GoTypeAssertion(GoExpression target, GoExpression type) {
		this.target = target;
		this.type = type;
	}

	public GoExpression getTarget() {
		return target;
	}

	/**
	 * @return the asserted type, or null for the x.(type) guard of a type switch
	 */
	public GoExpression getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeAssertion that = (GoTypeAssertion) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {

		return Objects.hash(target, type);
	}
}
