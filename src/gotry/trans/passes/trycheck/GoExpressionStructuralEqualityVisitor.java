package gotry.trans.passes.trycheck;

import gotry.model.golang.*;
import gotry.model.golang.type.*;

import java.util.List;
import java.util.Objects;

/**
 * Compares an expression against a fixed right-hand side by structure alone, ignoring source positions.
 *
 * The comparison is conservative: function literals are never equal to anything, and composite literals,
 * struct types and interface types only compare equal when neither side had elements elided.
 */
public class GoExpressionStructuralEqualityVisitor extends GoExpressionVisitor<Boolean, RuntimeException> {

	private final GoExpression rhs;

	public GoExpressionStructuralEqualityVisitor(GoExpression rhs) {
		this.rhs = rhs;
	}

	public static boolean equal(GoExpression lhs, GoExpression rhs) {
		if (lhs == null || rhs == null) {
			return lhs == rhs;
		}
		return lhs.accept(new GoExpressionStructuralEqualityVisitor(rhs));
	}

	public static boolean equalList(List<? extends GoExpression> lhs, List<? extends GoExpression> rhs) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		for (int i = 0; i < lhs.size(); ++i) {
			if (!equal(lhs.get(i), rhs.get(i))) {
				return false;
			}
		}
		return true;
	}

	public static boolean equalFields(List<GoField> lhs, List<GoField> rhs) {
		if (lhs.size() != rhs.size()) {
			return false;
		}
		for (int i = 0; i < lhs.size(); ++i) {
			GoField l = lhs.get(i);
			GoField r = rhs.get(i);
			if (!l.getNames().equals(r.getNames()) || !equal(l.getType(), r.getType()) ||
					!equal(l.getTag(), r.getTag())) {
				return false;
			}
		}
		return true;
	}

	@SuppressWarnings("unchecked")
	private <T extends GoExpression> T getRhs(T lhs) {
		if (lhs.getClass().isInstance(rhs)) {
			return (T) rhs;
		}
		return null;
	}

	@Override
	public Boolean visit(GoVariableName v) throws RuntimeException {
		GoVariableName rhs = getRhs(v);
		return rhs != null && v.getName().equals(rhs.getName());
	}

	@Override
	public Boolean visit(GoBuiltins.BuiltinConstant v) throws RuntimeException {
		GoBuiltins.BuiltinConstant rhs = getRhs(v);
		return rhs != null && v.getValue().equals(rhs.getValue());
	}

	// literals compare by text, so 0x10 and 16 differ

	@Override
	public Boolean visit(GoIntLiteral intLiteral) throws RuntimeException {
		GoIntLiteral rhs = getRhs(intLiteral);
		return rhs != null && intLiteral.getText().equals(rhs.getText());
	}

	@Override
	public Boolean visit(GoFloatLiteral floatLiteral) throws RuntimeException {
		GoFloatLiteral rhs = getRhs(floatLiteral);
		return rhs != null && floatLiteral.getText().equals(rhs.getText());
	}

	@Override
	public Boolean visit(GoImaginaryLiteral imaginaryLiteral) throws RuntimeException {
		GoImaginaryLiteral rhs = getRhs(imaginaryLiteral);
		return rhs != null && imaginaryLiteral.getText().equals(rhs.getText());
	}

	@Override
	public Boolean visit(GoRuneLiteral runeLiteral) throws RuntimeException {
		GoRuneLiteral rhs = getRhs(runeLiteral);
		return rhs != null && runeLiteral.getText().equals(rhs.getText());
	}

	@Override
	public Boolean visit(GoStringLiteral stringLiteral) throws RuntimeException {
		GoStringLiteral rhs = getRhs(stringLiteral);
		return rhs != null && stringLiteral.getText().equals(rhs.getText());
	}

	@Override
	public Boolean visit(GoCompositeLiteral compositeLiteral) throws RuntimeException {
		GoCompositeLiteral rhs = getRhs(compositeLiteral);
		return rhs != null && !compositeLiteral.isIncomplete() && !rhs.isIncomplete() &&
				equal(compositeLiteral.getType(), rhs.getType()) &&
				equalList(compositeLiteral.getElements(), rhs.getElements());
	}

	@Override
	public Boolean visit(GoKeyValue keyValue) throws RuntimeException {
		GoKeyValue rhs = getRhs(keyValue);
		return rhs != null && equal(keyValue.getKey(), rhs.getKey()) && equal(keyValue.getValue(), rhs.getValue());
	}

	@Override
	public Boolean visit(GoParenthesized parenthesized) throws RuntimeException {
		GoParenthesized rhs = getRhs(parenthesized);
		return rhs != null && equal(parenthesized.getInner(), rhs.getInner());
	}

	@Override
	public Boolean visit(GoSelectorExpression dot) throws RuntimeException {
		GoSelectorExpression rhs = getRhs(dot);
		return rhs != null && dot.getName().equals(rhs.getName()) && equal(dot.getLHS(), rhs.getLHS());
	}

	@Override
	public Boolean visit(GoIndexExpression index) throws RuntimeException {
		GoIndexExpression rhs = getRhs(index);
		return rhs != null && equal(index.getTarget(), rhs.getTarget()) &&
				equalList(index.getIndices(), rhs.getIndices());
	}

	@Override
	public Boolean visit(GoSliceOperator slice) throws RuntimeException {
		GoSliceOperator rhs = getRhs(slice);
		return rhs != null && slice.isSlice3() == rhs.isSlice3() && equal(slice.getTarget(), rhs.getTarget()) &&
				equal(slice.getLow(), rhs.getLow()) && equal(slice.getHigh(), rhs.getHigh()) &&
				equal(slice.getMax(), rhs.getMax());
	}

	@Override
	public Boolean visit(GoTypeAssertion typeAssertion) throws RuntimeException {
		GoTypeAssertion rhs = getRhs(typeAssertion);
		return rhs != null && equal(typeAssertion.getTarget(), rhs.getTarget()) &&
				equal(typeAssertion.getType(), rhs.getType());
	}

	@Override
	public Boolean visit(GoAnonymousFunction anonymousFunction) throws RuntimeException {
		return false;
	}

	@Override
	public Boolean visit(GoCall call) throws RuntimeException {
		GoCall rhs = getRhs(call);
		return rhs != null && call.hasEllipsis() == rhs.hasEllipsis() && equal(call.getTarget(), rhs.getTarget()) &&
				equalList(call.getArguments(), rhs.getArguments());
	}

	@Override
	public Boolean visit(GoBinop binop) throws RuntimeException {
		GoBinop rhs = getRhs(binop);
		return rhs != null && binop.getOperation() == rhs.getOperation() && equal(binop.getLHS(), rhs.getLHS()) &&
				equal(binop.getRHS(), rhs.getRHS());
	}

	@Override
	public Boolean visit(GoUnary unary) throws RuntimeException {
		GoUnary rhs = getRhs(unary);
		return rhs != null && unary.getOperation() == rhs.getOperation() && equal(unary.getTarget(), rhs.getTarget());
	}

	@Override
	public Boolean visit(GoEllipsis ellipsis) throws RuntimeException {
		GoEllipsis rhs = getRhs(ellipsis);
		return rhs != null && equal(ellipsis.getElementType(), rhs.getElementType());
	}

	@Override
	public Boolean visit(GoType type) throws RuntimeException {
		if (!(rhs instanceof GoType)) {
			return false;
		}
		return type.accept(new TypeEquality((GoType) rhs));
	}

	private static class TypeEquality extends GoTypeVisitor<Boolean, RuntimeException> {

		private final GoType rhs;

		TypeEquality(GoType rhs) {
			this.rhs = rhs;
		}

		@SuppressWarnings("unchecked")
		private <T extends GoType> T getRhs(T lhs) {
			if (lhs.getClass().isInstance(rhs)) {
				return (T) rhs;
			}
			return null;
		}

		@Override
		public Boolean visit(GoArrayType arrayType) throws RuntimeException {
			GoArrayType rhs = getRhs(arrayType);
			return rhs != null && equal(arrayType.getLength(), rhs.getLength()) &&
					equal(arrayType.getElementType(), rhs.getElementType());
		}

		@Override
		public Boolean visit(GoChanType chanType) throws RuntimeException {
			GoChanType rhs = getRhs(chanType);
			return rhs != null && chanType.getDirection() == rhs.getDirection() &&
					equal(chanType.getElementType(), rhs.getElementType());
		}

		@Override
		public Boolean visit(GoFuncType funcType) throws RuntimeException {
			GoFuncType rhs = getRhs(funcType);
			return rhs != null && equalFields(funcType.getTypeParameters(), rhs.getTypeParameters()) &&
					equalFields(funcType.getParameters(), rhs.getParameters()) &&
					equalFields(funcType.getResults(), rhs.getResults());
		}

		@Override
		public Boolean visit(GoInterfaceType interfaceType) throws RuntimeException {
			GoInterfaceType rhs = getRhs(interfaceType);
			return rhs != null && !interfaceType.isIncomplete() && !rhs.isIncomplete() &&
					equalFields(interfaceType.getElements(), rhs.getElements());
		}

		@Override
		public Boolean visit(GoMapType mapType) throws RuntimeException {
			GoMapType rhs = getRhs(mapType);
			return rhs != null && equal(mapType.getKeyType(), rhs.getKeyType()) &&
					equal(mapType.getValueType(), rhs.getValueType());
		}

		@Override
		public Boolean visit(GoPtrType ptrType) throws RuntimeException {
			GoPtrType rhs = getRhs(ptrType);
			return rhs != null && equal(ptrType.getPointee(), rhs.getPointee());
		}

		@Override
		public Boolean visit(GoStructType structType) throws RuntimeException {
			GoStructType rhs = getRhs(structType);
			return rhs != null && !structType.isIncomplete() && !rhs.isIncomplete() &&
					equalFields(structType.getFields(), rhs.getFields());
		}

		@Override
		public Boolean visit(GoTypeName typeName) throws RuntimeException {
			GoTypeName rhs = getRhs(typeName);
			return rhs != null && Objects.equals(typeName.getQualifier(), rhs.getQualifier()) &&
					typeName.getName().equals(rhs.getName());
		}
	}
}
