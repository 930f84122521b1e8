package gotry.model.golang;

import java.util.Objects;

public class GoImaginaryLiteral extends GoExpression {

	private final String text;

	public GoImaginaryLiteral(String text) {
		this.text = text;
	}

	/**
	 * @return the literal exactly as written in the source, including the trailing i
	 */
	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoImaginaryLiteral that = (GoImaginaryLiteral) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
