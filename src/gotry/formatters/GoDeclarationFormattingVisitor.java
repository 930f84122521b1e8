package gotry.formatters;

import gotry.model.golang.GoDeclarationVisitor;
import gotry.model.golang.GoFunctionDeclaration;
import gotry.model.golang.GoTypeDeclaration;
import gotry.model.golang.GoVariableDeclaration;

import java.io.IOException;

public class GoDeclarationFormattingVisitor extends GoDeclarationVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GoDeclarationFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GoFunctionDeclaration functionDeclaration) throws IOException {
		out.write("func ");
		if(functionDeclaration.getReceiver() != null) {
			out.write("(");
			functionDeclaration.getReceiver().accept(new GoNodeFormattingVisitor(out));
			out.write(") ");
		}
		out.write(functionDeclaration.getName());
		GoTypeFormattingVisitor.writeSignature(out, functionDeclaration.getType());
		if(functionDeclaration.getBody() != null) {
			out.write(" ");
			functionDeclaration.getBody().accept(new GoStatementFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(GoTypeDeclaration typeDeclaration) throws IOException {
		out.write("type ");
		out.write(typeDeclaration.getName());
		if(!typeDeclaration.getTypeParameters().isEmpty()) {
			out.write("[");
			GoTypeFormattingVisitor.writeFields(out, typeDeclaration.getTypeParameters());
			out.write("]");
		}
		out.write(typeDeclaration.isAlias() ? " = " : " ");
		typeDeclaration.getType().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoVariableDeclaration variableDeclaration) throws IOException {
		out.write(variableDeclaration.isConstant() ? "const " : "var ");
		out.write(String.join(", ", variableDeclaration.getNames()));
		if(variableDeclaration.getType() != null) {
			out.write(" ");
			variableDeclaration.getType().accept(new GoExpressionFormattingVisitor(out));
		}
		if(!variableDeclaration.getValues().isEmpty()) {
			out.write(" = ");
			FormattingTools.writeCommaSeparated(out, variableDeclaration.getValues(),
					value -> value.accept(new GoExpressionFormattingVisitor(out)));
		}
		return null;
	}

}
