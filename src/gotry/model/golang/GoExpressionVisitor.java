package gotry.model.golang;

import gotry.model.golang.type.GoType;

public abstract class GoExpressionVisitor<T, E extends Throwable> {

	public abstract T visit(GoVariableName v) throws E;
	public abstract T visit(GoBuiltins.BuiltinConstant v) throws E;
	public abstract T visit(GoIntLiteral intLiteral) throws E;
	public abstract T visit(GoFloatLiteral floatLiteral) throws E;
	public abstract T visit(GoImaginaryLiteral imaginaryLiteral) throws E;
	public abstract T visit(GoRuneLiteral runeLiteral) throws E;
	public abstract T visit(GoStringLiteral stringLiteral) throws E;
	public abstract T visit(GoCompositeLiteral compositeLiteral) throws E;
	public abstract T visit(GoKeyValue keyValue) throws E;
	public abstract T visit(GoParenthesized parenthesized) throws E;
	public abstract T visit(GoSelectorExpression dot) throws E;
	public abstract T visit(GoIndexExpression index) throws E;
	public abstract T visit(GoSliceOperator slice) throws E;
	public abstract T visit(GoTypeAssertion typeAssertion) throws E;
	public abstract T visit(GoAnonymousFunction anonymousFunction) throws E;
	public abstract T visit(GoCall call) throws E;
	public abstract T visit(GoBinop binop) throws E;
	public abstract T visit(GoUnary unary) throws E;
	public abstract T visit(GoEllipsis ellipsis) throws E;
	public abstract T visit(GoType type) throws E;

}
