package gotry.formatters;

import gotry.model.golang.*;

import java.io.IOException;
import java.util.List;

public class GoStatementFormattingVisitor extends GoStatementVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GoStatementFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	static void writeClauseBody(IndentingWriter out, List<GoStatement> statements) throws IOException {
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (GoStatement stmt : statements) {
				out.newLine();
				stmt.accept(new GoStatementFormattingVisitor(out));
			}
		}
	}

	private void writeExpressions(List<GoExpression> expressions) throws IOException {
		FormattingTools.writeCommaSeparated(out, expressions,
				e -> e.accept(new GoExpressionFormattingVisitor(out)));
	}

	private void writeCases(List<? extends GoNode> cases) throws IOException {
		out.write("{");
		for (GoNode c : cases) {
			out.newLine();
			c.accept(new GoNodeFormattingVisitor(out));
		}
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(GoAssignmentStatement assignment) throws IOException {
		writeExpressions(assignment.getNames());
		if (assignment.isDefinition()) {
			out.write(" := ");
		} else {
			out.write(" = ");
		}
		writeExpressions(assignment.getValues());
		return null;
	}

	@Override
	public Void visit(GoOperatorAssignment operatorAssignment) throws IOException {
		operatorAssignment.getLHS().accept(new GoExpressionFormattingVisitor(out));
		out.write(" ");
		out.write(operatorAssignment.getOperation().getSymbol());
		out.write("= ");
		operatorAssignment.getRHS().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoReturn goReturn) throws IOException {
		out.write("return");
		List<GoExpression> expressions = goReturn.getValues();
		if (expressions.isEmpty()) {
			return null;
		}
		out.write(" ");
		writeExpressions(expressions);
		return null;
	}

	@Override
	public Void visit(GoBlock block) throws IOException {
		out.write("{");
		out.newLine();
		try (IndentingWriter.Indent ignored = out.indent()) {
			for (GoStatement stmt : block.getStatements()) {
				stmt.accept(this);
				out.newLine();
			}
		}
		out.write("}");
		return null;
	}

	@Override
	public Void visit(GoFor goFor) throws IOException {
		out.write("for ");
		if (goFor.getInit() != null || goFor.getIncrement() != null) {
			if (goFor.getInit() != null) {
				goFor.getInit().accept(this);
			}
			out.write("; ");
			if (goFor.getCondition() != null) {
				goFor.getCondition().accept(new GoExpressionFormattingVisitor(out));
			}
			out.write("; ");
			if (goFor.getIncrement() != null) {
				goFor.getIncrement().accept(this);
				out.write(" ");
			}
		} else if (goFor.getCondition() != null) {
			goFor.getCondition().accept(new GoExpressionFormattingVisitor(out));
			out.write(" ");
		}
		goFor.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(GoForRange forRange) throws IOException {
		out.write("for ");
		if (!forRange.getLhs().isEmpty()) {
			writeExpressions(forRange.getLhs());
			if (forRange.isDefinition()) {
				out.write(" := ");
			} else {
				out.write(" = ");
			}
		}
		out.write("range ");
		forRange.getRangeExpression().accept(new GoExpressionFormattingVisitor(out));
		out.write(" ");
		forRange.getBody().accept(this);
		return null;
	}

	@Override
	public Void visit(GoIf goIf) throws IOException {
		out.write("if ");
		if (goIf.getInit() != null) {
			goIf.getInit().accept(this);
			out.write("; ");
		}
		goIf.getCond().accept(new GoExpressionFormattingVisitor(out));
		out.write(" ");
		goIf.getThen().accept(this);
		if (goIf.getElse() != null) {
			out.write(" else ");
			goIf.getElse().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GoSwitch goSwitch) throws IOException {
		out.write("switch ");
		if (goSwitch.getInit() != null) {
			goSwitch.getInit().accept(this);
			out.write("; ");
		}
		if (goSwitch.getTag() != null) {
			goSwitch.getTag().accept(new GoExpressionFormattingVisitor(out));
			out.write(" ");
		}
		writeCases(goSwitch.getCases());
		return null;
	}

	@Override
	public Void visit(GoTypeSwitch typeSwitch) throws IOException {
		out.write("switch ");
		if (typeSwitch.getInit() != null) {
			typeSwitch.getInit().accept(this);
			out.write("; ");
		}
		typeSwitch.getAssign().accept(this);
		out.write(" ");
		writeCases(typeSwitch.getCases());
		return null;
	}

	@Override
	public Void visit(GoLabeledStatement labeledStatement) throws IOException {
		out.write(labeledStatement.getLabel());
		out.write(":");
		out.newLine();
		labeledStatement.getStatement().accept(this);
		return null;
	}

	@Override
	public Void visit(GoSelect select) throws IOException {
		out.write("select ");
		writeCases(select.getCases());
		return null;
	}

	@Override
	public Void visit(GoTo goTo) throws IOException {
		out.write("goto ");
		out.write(goTo.getLabel());
		return null;
	}

	@Override
	public Void visit(GoIncDec incDec) throws IOException {
		incDec.getTarget().accept(new GoExpressionFormattingVisitor(out));
		if (incDec.isInc()) {
			out.write("++");
		} else {
			out.write("--");
		}
		return null;
	}

	@Override
	public Void visit(GoExpressionStatement expressionStatement) throws IOException {
		expressionStatement.getExpression().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoSend send) throws IOException {
		send.getChannel().accept(new GoExpressionFormattingVisitor(out));
		out.write(" <- ");
		send.getValue().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoBreak break1) throws IOException {
		out.write("break");
		if (break1.getLabel() != null) {
			out.write(" ");
			out.write(break1.getLabel());
		}
		return null;
	}

	@Override
	public Void visit(GoContinue continue1) throws IOException {
		out.write("continue");
		if (continue1.getLabel() != null) {
			out.write(" ");
			out.write(continue1.getLabel());
		}
		return null;
	}

	@Override
	public Void visit(GoFallthrough fallthrough) throws IOException {
		out.write("fallthrough");
		return null;
	}

	@Override
	public Void visit(GoDefer defer) throws IOException {
		out.write("defer ");
		defer.getCall().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoRoutineStatement go) throws IOException {
		out.write("go ");
		go.getCall().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoDeclarationStatement declarationStatement) throws IOException {
		boolean isFirst = true;
		for (GoDeclaration declaration : declarationStatement.getDeclarations()) {
			if (!isFirst) {
				out.newLine();
			}
			isFirst = false;
			declaration.accept(new GoDeclarationFormattingVisitor(out));
		}
		return null;
	}

	@Override
	public Void visit(GoEmptyStatement emptyStatement) throws IOException {
		return null;
	}
}
