package gotry.model.golang;

/**
 * Visits the top-level declarations of a Go file; grouped declarations are split into one node per name list.
 */
public abstract class GoDeclarationVisitor<T, E extends Throwable> {
	public abstract T visit(GoFunctionDeclaration functionDeclaration) throws E;
	public abstract T visit(GoTypeDeclaration typeDeclaration) throws E;
	public abstract T visit(GoVariableDeclaration variableDeclaration) throws E;
}
