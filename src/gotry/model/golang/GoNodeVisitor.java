package gotry.model.golang;

public abstract class GoNodeVisitor<T, E extends Throwable> {

	public abstract T visit(GoModule module) throws E;
	public abstract T visit(GoImport goImport) throws E;
	public abstract T visit(GoStatement statement) throws E;
	public abstract T visit(GoDeclaration declaration) throws E;
	public abstract T visit(GoExpression expression) throws E;
	public abstract T visit(GoField field) throws E;
	public abstract T visit(GoSwitchCase switchCase) throws E;
	public abstract T visit(GoSelectCase selectCase) throws E;
}
