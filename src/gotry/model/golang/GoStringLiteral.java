package gotry.model.golang;

import java.util.Objects;

/**
 * An interpreted ("...") or raw (`...`) string literal
 */
public class GoStringLiteral extends GoExpression {

	private final String text;

	public GoStringLiteral(String text) {
		this.text = text;
	}

	/**
	 * @return the literal exactly as written in the source, including the quotes or backquotes
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
		GoStringLiteral that = (GoStringLiteral) o;
		return Objects.equals(text, that.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(text);
	}
}
