package gotry.model.golang;

import java.util.Objects;

public final class GoBuiltins {

	private GoBuiltins() {}

	/**
	 * A builtin introduced by the tool itself. The parser never produces these: a user function that happens to
	 * be called "try" is a {@link GoVariableName}.
	 */
	public static class BuiltinConstant extends GoExpression {
		private final String value;

		public BuiltinConstant(String value) {
			this.value = value;
		}

		public String getValue() {
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
			BuiltinConstant that = (BuiltinConstant) o;
			return Objects.equals(value, that.value);
		}

		@Override
		public int hashCode() {

			return Objects.hash(value);
		}
	}

	public static final String NIL = "nil";
	public static final String BLANK = "_";

	// the guarded call builtin written by the rewrite
	public static final BuiltinConstant Try = new BuiltinConstant("try");

	public static boolean isTry(GoExpression expression) {
		return expression instanceof GoCall && Try.equals(((GoCall) expression).getTarget());
	}
}
