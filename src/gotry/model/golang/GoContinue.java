package gotry.model.golang;

import java.util.Objects;

public class GoContinue extends GoStatement {

	private final String label;

	public GoContinue(String label) {
		this.label = label;
	}

	/**
	 * @return the target label, or null
	 */
	public String getLabel() {
		return label;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoContinue that = (GoContinue) o;
		return Objects.equals(label, that.label);
	}

	@Override
	public int hashCode() {
		return Objects.hash(label);
	}
}
