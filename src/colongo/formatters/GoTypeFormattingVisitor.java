package colongo.formatters;

import colongo.model.golang.GoNode;
import colongo.model.golang.GoVariableName;
import colongo.model.golang.type.*;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.util.List;

public class GoTypeFormattingVisitor extends GoTypeVisitor<Void, IOException> {

	private final GoSourceWriter out;

	public GoTypeFormattingVisitor(GoSourceWriter out) {
		this.out = out;
	}

	public void writeSignature(GoFunctionType signature) throws IOException {
		writeParameters(signature.getParameters());
		List<GoFunctionParameter> results = signature.getResults();
		if (results.isEmpty()) {
			return;
		}
		out.write(" ");
		if (results.size() == 1 && results.get(0).getNames().isEmpty()) {
			// a single anonymous result needs no parentheses
			results.get(0).getType().accept(this);
			return;
		}
		writeParameters(results);
	}

	public void writeParameters(List<GoFunctionParameter> parameters) throws IOException {
		out.write("(");
		FormattingTools.writeCommaSeparated(out, parameters, p -> p.accept(new GoNodeFormattingVisitor(out)));
		out.write(")");
	}

	private static boolean isOneLine(SourceLocation location) {
		return !location.isUnknown() && location.getStartLine() == location.getEndLine();
	}

	private void openFieldList(String keyword, SourceLocation location) throws IOException {
		out.write(keyword);
		out.write(" {");
		if (!location.isUnknown()) {
			out.trailingComments(location.getStartLine());
		}
	}

	private void closeFieldList(SourceLocation location) throws IOException {
		out.flushCommentsBefore(location);
		out.unindent(1);
		out.newLine();
		out.write("}");
	}

	private void writeNames(List<GoVariableName> names) throws IOException {
		FormattingTools.writeCommaSeparated(out, names, n -> out.write(n.getName()));
	}

	@Override
	public Void visit(GoTypeName typeName) throws IOException {
		out.write(typeName.getName());
		return null;
	}

	@Override
	public Void visit(GoPtrType ptrType) throws IOException {
		out.write("*");
		ptrType.getElementType().accept(this);
		return null;
	}

	@Override
	public Void visit(GoSliceType sliceType) throws IOException {
		out.write("[]");
		sliceType.getElementType().accept(this);
		return null;
	}

	@Override
	public Void visit(GoArrayType arrayType) throws IOException {
		out.write("[");
		if (arrayType.getLength() == null) {
			out.write("...");
		} else {
			arrayType.getLength().accept(new GoExpressionFormattingVisitor(out));
		}
		out.write("]");
		arrayType.getElementType().accept(this);
		return null;
	}

	@Override
	public Void visit(GoMapType mapType) throws IOException {
		out.write("map[");
		mapType.getKeyType().accept(this);
		out.write("]");
		mapType.getValueType().accept(this);
		return null;
	}

	@Override
	public Void visit(GoChanType chanType) throws IOException {
		switch (chanType.getDirection()) {
			case SEND:
				out.write("chan<- ");
				break;
			case RECV:
				out.write("<-chan ");
				break;
			default:
				out.write("chan ");
				break;
		}
		chanType.getElementType().accept(this);
		return null;
	}

	@Override
	public Void visit(GoFunctionType functionType) throws IOException {
		out.write("func");
		writeSignature(functionType);
		return null;
	}

	@Override
	public Void visit(GoStructType structType) throws IOException {
		List<GoStructTypeField> fields = structType.getFields();
		SourceLocation location = structType.getLocation();
		if (isOneLine(location) && !out.hasCommentsWithin(location)) {
			if (fields.isEmpty()) {
				out.write("struct{}");
				return null;
			}
			GoStructTypeField only = fields.get(0);
			if (fields.size() == 1 && only.getTag() == null && only.getNames().size() <= 1) {
				out.write("struct{ ");
				only.accept(new GoNodeFormattingVisitor(out));
				out.write(" }");
				return null;
			}
		}
		openFieldList("struct", location);
		out.indent();
		// a lone field is not aligned with anything
		boolean align = fields.size() > 1;
		for (GoStructTypeField field : fields) {
			out.newLine();
			out.beginNode(field.getLocation());
			int extraTabs;
			if (field.isEmbedded()) {
				field.getType().accept(this);
				extraTabs = 2;
			} else {
				writeNames(field.getNames());
				writeSeparator(align);
				field.getType().accept(this);
				extraTabs = 1;
			}
			if (field.getTag() != null) {
				if (field.isEmbedded() && align) {
					writeSeparator(true);
				}
				writeSeparator(align);
				out.writeVerbatim(field.getTag());
				extraTabs = 0;
			}
			out.endNode(field.getLocation(), align ? extraTabs : 0);
		}
		closeFieldList(location);
		return null;
	}

	private void writeSeparator(boolean align) throws IOException {
		if (align) {
			out.writeCellBreak();
		} else {
			out.write(" ");
		}
	}

	@Override
	public Void visit(GoInterfaceType interfaceType) throws IOException {
		List<GoInterfaceTypeField> fields = interfaceType.getFields();
		SourceLocation location = interfaceType.getLocation();
		if (isOneLine(location) && !out.hasCommentsWithin(location)) {
			if (fields.isEmpty()) {
				out.write("interface{}");
				return null;
			}
			if (fields.size() == 1) {
				out.write("interface{ ");
				fields.get(0).accept(new GoNodeFormattingVisitor(out));
				out.write(" }");
				return null;
			}
		}
		openFieldList("interface", location);
		out.indent();
		for (GoNode field : fields) {
			out.newLine();
			out.beginNode(field.getLocation());
			field.accept(new GoNodeFormattingVisitor(out));
			out.endNode(field.getLocation());
		}
		closeFieldList(location);
		return null;
	}

}
