package gotry.model.golang;

import java.util.Objects;

/**
 * x op= y
 */
public class GoOperatorAssignment extends GoStatement {

	private final GoExpression lhs;
	private final GoBinop.Operation operation;
	private final GoExpression rhs;

	public GoOperatorAssignment(GoExpression lhs, GoBinop.Operation operation, GoExpression rhs) {
		this.lhs = lhs;
		this.operation = operation;
		this.rhs = rhs;
	}

	public GoExpression getLHS() {
		return lhs;
	}

	public GoBinop.Operation getOperation() {
		return operation;
	}

	public GoExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoOperatorAssignment that = (GoOperatorAssignment) o;
		return operation == that.operation &&
				Objects.equals(lhs, that.lhs) &&
				Objects.equals(rhs, that.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(lhs, operation, rhs);
	}
}
