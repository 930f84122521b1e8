package gotry.model.golang;

import java.util.Objects;

/**
 * An identifier used as an operand
 */
public class GoVariableName extends GoExpression {

	private final String name;

	public GoVariableName(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	public boolean isNamed(String expected) {
		return name.equals(expected);
	}

	/**
	 * @return whether this is the blank identifier "_", which discards what is assigned to it
	 */
	public boolean isBlank() {
		return isNamed(GoBuiltins.BLANK);
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoVariableName that = (GoVariableName) o;
		return Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name);
	}
}
