package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * One var or const spec. Inside a const group the type and values may both be absent, repeating the
 * previous spec.
 */
public class GoVariableDeclaration extends GoDeclaration {

	private final boolean constant;
	private final List<String> names;
	private final GoExpression type;
	private final List<GoExpression> values;

	public GoVariableDeclaration(boolean constant, List<String> names, GoExpression type, List<GoExpression> values) {
		this.constant = constant;
		this.names = names;
		this.type = type;
		this.values = values;
	}

	public boolean isConstant() {
		return constant;
	}

	public List<String> getNames() {
		return names;
	}

	public GoExpression getType() {
		return type;
	}

	public List<GoExpression> getValues() {
		return values;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoVariableDeclaration that = (GoVariableDeclaration) o;
		return constant == that.constant &&
				Objects.equals(names, that.names) &&
				Objects.equals(type, that.type) &&
				Objects.equals(values, that.values);
	}

	@Override
	public int hashCode() {

		return Objects.hash(constant, names, type, values);
	}
}
