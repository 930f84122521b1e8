package gotry.model.golang;

import java.util.Objects;

public class GoParenthesized extends GoExpression {

	private final GoExpression inner;

	public GoParenthesized(GoExpression inner) {
		this.inner = inner;
	}

	public GoExpression getInner() {
		return inner;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoParenthesized that = (GoParenthesized) o;
		return Objects.equals(inner, that.inner);
	}

	@Override
	public int hashCode() {
		return Objects.hash(inner);
	}
}
