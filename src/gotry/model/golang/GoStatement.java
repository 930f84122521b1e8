package gotry.model.golang;

/**
 * A statement inside a function body. Statement lists are mutable so passes can rewrite them in place.
 */
public abstract class GoStatement extends GoNode {
	
	public abstract <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E;
	
	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
