package gotry.formatters;

import gotry.model.golang.GoField;
import gotry.model.golang.type.*;

import java.io.IOException;
import java.util.List;

public class GoTypeFormattingVisitor extends GoTypeVisitor<Void, IOException> {

	private final IndentingWriter out;

	public GoTypeFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	/**
	 * Writes everything of a function type after the func keyword (or the method name):
	 * [type params](params) results
	 */
	static void writeSignature(IndentingWriter out, GoFuncType type) throws IOException {
		if (!type.getTypeParameters().isEmpty()) {
			out.write("[");
			writeFields(out, type.getTypeParameters());
			out.write("]");
		}
		out.write("(");
		writeFields(out, type.getParameters());
		out.write(")");
		List<GoField> results = type.getResults();
		if (results.isEmpty()) {
			return;
		}
		out.write(" ");
		if (results.size() == 1 && results.get(0).getNames().isEmpty()) {
			results.get(0).accept(new GoNodeFormattingVisitor(out));
		} else {
			out.write("(");
			writeFields(out, results);
			out.write(")");
		}
	}

	static void writeFields(IndentingWriter out, List<GoField> fields) throws IOException {
		FormattingTools.writeCommaSeparated(out, fields, f -> f.accept(new GoNodeFormattingVisitor(out)));
	}

	private void writeMembers(List<GoField> members, FormattingTools.Formatter<GoField> member) throws IOException {
		out.write("{");
		if (!members.isEmpty()) {
			out.write(" ");
			// single line: { a int; b string }
			FormattingTools.writeSeparated(out, members, "; ", member);
			out.write(" ");
		}
		out.write("}");
	}

	@Override
	public Void visit(GoArrayType arrayType) throws IOException {
		out.write("[");
		if (arrayType.getLength() != null) {
			arrayType.getLength().accept(new GoExpressionFormattingVisitor(out));
		}
		out.write("]");
		arrayType.getElementType().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoChanType chanType) throws IOException {
		switch (chanType.getDirection()) {
			case BOTH:
				out.write("chan ");
				break;
			case SEND:
				out.write("chan<- ");
				break;
			case RECV:
				out.write("<-chan ");
				break;
		}
		chanType.getElementType().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoFuncType funcType) throws IOException {
		out.write("func");
		writeSignature(out, funcType);
		return null;
	}

	@Override
	public Void visit(GoInterfaceType interfaceType) throws IOException {
		out.write("interface");
		writeMembers(interfaceType.getElements(), element -> {
			if (element.getNames().size() == 1 && element.getType() instanceof GoFuncType) {
				out.write(element.getNames().get(0));
				writeSignature(out, (GoFuncType) element.getType());
			} else {
				element.accept(new GoNodeFormattingVisitor(out));
			}
		});
		return null;
	}

	@Override
	public Void visit(GoMapType mapType) throws IOException {
		out.write("map[");
		mapType.getKeyType().accept(new GoExpressionFormattingVisitor(out));
		out.write("]");
		mapType.getValueType().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoPtrType ptrType) throws IOException {
		out.write("*");
		ptrType.getPointee().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoStructType structType) throws IOException {
		out.write("struct");
		writeMembers(structType.getFields(), field -> field.accept(new GoNodeFormattingVisitor(out)));
		return null;
	}

	@Override
	public Void visit(GoTypeName typeName) throws IOException {
		if (typeName.getQualifier() != null) {
			out.write(typeName.getQualifier());
			out.write(".");
		}
		out.write(typeName.getName());
		return null;
	}

}
