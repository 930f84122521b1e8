package gotry.model.golang;

import java.util.List;
import java.util.Objects;

public class GoForRange extends GoStatement {

	private final List<GoExpression> lhs;
	private final boolean defines;
	private final GoExpression rangeExpression;
	private final GoBlock body;

	/**
	 * @param lhs the key and value targets, empty for "for range x"
	 */
	public GoForRange(List<GoExpression> lhs, boolean defines, GoExpression rangeExpression, GoBlock body) {
		this.lhs = lhs;
		this.defines = defines;
		this.rangeExpression = rangeExpression;
		this.body = body;
	}

	public List<GoExpression> getLhs() {
		return lhs;
	}

	public boolean isDefinition() {
		return defines;
	}

	public GoExpression getRangeExpression() {
		return rangeExpression;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoForRange forRange = (GoForRange) o;
		return defines == forRange.defines &&
				Objects.equals(lhs, forRange.lhs) &&
				Objects.equals(rangeExpression, forRange.rangeExpression) &&
				Objects.equals(body, forRange.body);
	}

	@Override
	public int hashCode() {

		return Objects.hash(lhs, defines, rangeExpression, body);
	}
}
