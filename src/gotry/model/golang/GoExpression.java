package gotry.model.golang;

/**
 * A Go expression base class. Type expressions are expressions too, since Go allows them wherever an
 * operand is expected (conversions, composite literals, generic instantiation).
 */
public abstract class GoExpression extends GoNode {

	public abstract <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E;
	
	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
	
}
