package gotry.formatters;

import gotry.model.golang.*;
import gotry.model.golang.GoBuiltins.BuiltinConstant;
import gotry.model.golang.type.GoType;

import java.io.IOException;

/**
 * Writes expressions as Go source. Parentheses are written only where the tree holds a {@link GoParenthesized},
 * which the parser keeps, so parsed expressions print back with their original grouping.
 */
public class GoExpressionFormattingVisitor extends GoExpressionVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GoExpressionFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GoVariableName v) throws IOException {
		out.write(v.getName());
		return null;
	}

	@Override
	public Void visit(BuiltinConstant v) throws IOException {
		out.write(v.getValue());
		return null;
	}

	@Override
	public Void visit(GoIntLiteral intLiteral) throws IOException {
		out.write(intLiteral.getText());
		return null;
	}

	@Override
	public Void visit(GoFloatLiteral floatLiteral) throws IOException {
		out.write(floatLiteral.getText());
		return null;
	}

	@Override
	public Void visit(GoImaginaryLiteral imaginaryLiteral) throws IOException {
		out.write(imaginaryLiteral.getText());
		return null;
	}

	@Override
	public Void visit(GoRuneLiteral runeLiteral) throws IOException {
		out.write(runeLiteral.getText());
		return null;
	}

	@Override
	public Void visit(GoStringLiteral stringLiteral) throws IOException {
		out.write(stringLiteral.getText());
		return null;
	}

	@Override
	public Void visit(GoCompositeLiteral compositeLiteral) throws IOException {
		if (compositeLiteral.getType() != null) {
			compositeLiteral.getType().accept(this);
		}
		out.write("{");
		FormattingTools.writeCommaSeparated(out, compositeLiteral.getElements(), e -> e.accept(this));
		out.write("}");
		return null;
	}

	@Override
	public Void visit(GoKeyValue keyValue) throws IOException {
		keyValue.getKey().accept(this);
		out.write(": ");
		keyValue.getValue().accept(this);
		return null;
	}

	@Override
	public Void visit(GoParenthesized parenthesized) throws IOException {
		out.write("(");
		parenthesized.getInner().accept(this);
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoSelectorExpression dot) throws IOException {
		dot.getLHS().accept(this);
		out.write(".");
		out.write(dot.getName());
		return null;
	}

	@Override
	public Void visit(GoIndexExpression index) throws IOException {
		index.getTarget().accept(this);
		out.write("[");
		FormattingTools.writeCommaSeparated(out, index.getIndices(), e -> e.accept(this));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(GoSliceOperator slice) throws IOException {
		slice.getTarget().accept(this);
		out.write("[");
		if (slice.getLow() != null) {
			slice.getLow().accept(this);
		}
		out.write(":");
		if (slice.getHigh() != null) {
			slice.getHigh().accept(this);
		}
		if (slice.isSlice3()) {
			out.write(":");
			slice.getMax().accept(this);
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(GoTypeAssertion typeAssertion) throws IOException {
		typeAssertion.getTarget().accept(this);
		out.write(".(");
		if (typeAssertion.getType() == null) {
			out.write("type");
		} else {
			typeAssertion.getType().accept(this);
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoAnonymousFunction anonymousFunction) throws IOException {
		out.write("func");
		GoTypeFormattingVisitor.writeSignature(out, anonymousFunction.getType());
		out.write(" ");
		anonymousFunction.getBody().accept(new GoStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoCall call) throws IOException {
		call.getTarget().accept(this);
		out.write("(");
		FormattingTools.writeCommaSeparated(out, call.getArguments(), arg -> arg.accept(this));
		if (call.hasEllipsis()) {
			out.write("...");
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoBinop binop) throws IOException {
		binop.getLHS().accept(this);
		out.write(" ");
		out.write(binop.getOperation().getSymbol());
		out.write(" ");
		binop.getRHS().accept(this);
		return null;
	}

	@Override
	public Void visit(GoUnary unary) throws IOException {
		out.write(unary.getOperation().getSymbol());
		unary.getTarget().accept(this);
		return null;
	}

	@Override
	public Void visit(GoEllipsis ellipsis) throws IOException {
		out.write("...");
		if (ellipsis.getElementType() != null) {
			ellipsis.getElementType().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GoType type) throws IOException {
		type.accept(new GoTypeFormattingVisitor(out));
		return null;
	}

}
