package gotry.model.golang;

import gotry.model.golang.type.GoFuncType;

import java.util.Objects;

/**
 * A function literal
 */
public class GoAnonymousFunction extends GoExpression {

	private final GoFuncType type;
	private final GoBlock body;

	public GoAnonymousFunction(GoFuncType type, GoBlock body) {
		this.type = type;
		this.body = body;
	}

	public GoFuncType getType() {
		return type;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoAnonymousFunction that = (GoAnonymousFunction) o;
		return Objects.equals(type, that.type) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {

		return Objects.hash(type, body);
	}
}
