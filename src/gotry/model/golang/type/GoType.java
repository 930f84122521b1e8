package gotry.model.golang.type;

import gotry.model.golang.GoExpression;
import gotry.model.golang.GoExpressionVisitor;

public abstract class GoType extends GoExpression {
	
	public abstract <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E;
	
	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
