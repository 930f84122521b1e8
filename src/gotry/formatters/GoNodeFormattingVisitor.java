package gotry.formatters;

import gotry.model.golang.*;

import java.io.IOException;

public class GoNodeFormattingVisitor extends GoNodeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GoNodeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(GoModule module) throws IOException {
		out.write("package ");
		out.write(module.getPackageName());
		out.newLine();
		if(!module.getImports().isEmpty()) {
			out.newLine();
			out.write("import (");
			out.newLine();
			try(IndentingWriter.Indent ignored = out.indent()){
				for(GoImport imp : module.getImports()) {
					imp.accept(this);
					out.newLine();
				}
			}
			out.write(")");
			out.newLine();
		}
		for(GoDeclaration decl : module.getDeclarations()) {
			out.newLine();
			decl.accept(this);
			out.newLine();
		}
		return null;
	}

	@Override
	public Void visit(GoImport goImport) throws IOException {
		if(goImport.getName() != null) {
			out.write(goImport.getName());
			out.write(" ");
		}
		goImport.getPath().accept(this);
		return null;
	}

	@Override
	public Void visit(GoStatement statement) throws IOException {
		statement.accept(new GoStatementFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoDeclaration declaration) throws IOException {
		declaration.accept(new GoDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoExpression expression) throws IOException {
		expression.accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoField field) throws IOException {
		if(!field.getNames().isEmpty()) {
			out.write(String.join(", ", field.getNames()));
			out.write(" ");
		}
		field.getType().accept(new GoExpressionFormattingVisitor(out));
		if(field.getTag() != null) {
			out.write(" ");
			field.getTag().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GoSwitchCase switchCase) throws IOException {
		if(switchCase.isDefault()) {
			out.write("default:");
		} else {
			out.write("case ");
			FormattingTools.writeCommaSeparated(out, switchCase.getConditions(),
					cond -> cond.accept(new GoExpressionFormattingVisitor(out)));
			out.write(":");
		}
		GoStatementFormattingVisitor.writeClauseBody(out, switchCase.getBlock());
		return null;
	}

	@Override
	public Void visit(GoSelectCase selectCase) throws IOException {
		if(selectCase.isDefault()) {
			out.write("default:");
		} else {
			out.write("case ");
			selectCase.getComm().accept(this);
			out.write(":");
		}
		GoStatementFormattingVisitor.writeClauseBody(out, selectCase.getBlock());
		return null;
	}

}
