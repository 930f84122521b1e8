package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * A var, const or type declaration inside a function body. A parenthesized group holds one declaration per
 * spec.
 */
public class GoDeclarationStatement extends GoStatement {

	private final List<GoDeclaration> declarations;

	public GoDeclarationStatement(List<GoDeclaration> declarations) {
		this.declarations = declarations;
	}

	public List<GoDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoDeclarationStatement that = (GoDeclarationStatement) o;
		return Objects.equals(declarations, that.declarations);
	}

	@Override
	public int hashCode() {
		return Objects.hash(declarations);
	}
}
