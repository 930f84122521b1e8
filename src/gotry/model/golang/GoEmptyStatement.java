package gotry.model.golang;

public class GoEmptyStatement extends GoStatement {

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		return o != null && getClass() == o.getClass();
	}

	@Override
	public int hashCode() {
		return GoEmptyStatement.class.hashCode();
	}
}
