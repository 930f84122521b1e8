package gotry.model.golang;

import java.util.Objects;

public class GoLabeledStatement extends GoStatement {

	private final String label;
	private final GoStatement statement;

	public GoLabeledStatement(String label, GoStatement statement) {
		this.label = label;
		this.statement = statement;
	}

	public String getLabel() {
		return label;
	}

	public GoStatement getStatement() {
		return statement;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoLabeledStatement that = (GoLabeledStatement) o;
		return Objects.equals(label, that.label) &&
				Objects.equals(statement, that.statement);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label, statement);
	}
}
