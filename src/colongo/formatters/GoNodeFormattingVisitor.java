package colongo.formatters;

import colongo.model.golang.*;
import colongo.model.golang.type.GoFunctionParameter;
import colongo.model.golang.type.GoFunctionType;
import colongo.model.golang.type.GoInterfaceTypeField;
import colongo.model.golang.type.GoStructTypeField;

import java.io.IOException;
import java.util.List;

public class GoNodeFormattingVisitor extends GoNodeVisitor<Void, IOException> {

	private final GoSourceWriter out;

	public GoNodeFormattingVisitor(GoSourceWriter out) {
		this.out = out;
	}

	private static String declarationKind(GoDeclaration declaration) {
		if (declaration instanceof GoFunctionDeclaration) {
			return "func";
		} else if (declaration instanceof GoTypeDeclaration) {
			return "type";
		} else if (declaration instanceof GoImportDeclaration) {
			return "import";
		}
		return ((GoVariableDeclaration) declaration).isConstant() ? "const" : "var";
	}

	@Override
	public Void visit(GoModule module) throws IOException {
		out.queueComments(module.getComments());
		out.beginNode(module.getLocation());
		out.write("package ");
		out.write(module.getName());
		if (!module.getLocation().isUnknown()) {
			out.trailingComments(module.getLocation().getStartLine());
		}
		String previousKind = null;
		for (GoDeclaration declaration : module.getDeclarations()) {
			String kind = declarationKind(declaration);
			// declarations of a different kind, or with a doc comment, are set apart by a blank line
			boolean separate = !kind.equals(previousKind) || out.hasDocComment(declaration.getLocation());
			previousKind = kind;
			out.newLine();
			if (declaration.getLocation().isUnknown() && separate) {
				out.newLine();
			}
			out.beginNode(declaration.getLocation(), separate);
			declaration.accept(new GoDeclarationFormattingVisitor(out));
			out.endNode(declaration.getLocation());
		}
		out.flushRemainingComments();
		out.newLine();
		return null;
	}

	@Override
	public Void visit(GoComment comment) throws IOException {
		out.writeVerbatim(comment.getText());
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

	private void writeClauseBody(GoNode clause, List<GoStatement> body) throws IOException {
		if (!clause.getLocation().isUnknown()) {
			out.trailingComments(clause.getLocation().getStartLine());
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			new GoStatementFormattingVisitor(out).writeStatements(body);
		}
	}

	@Override
	public Void visit(GoSwitchCase switchCase) throws IOException {
		if (switchCase.isDefault()) {
			out.write("default:");
		} else {
			out.write("case ");
			new GoExpressionFormattingVisitor(out).writeExpressionList(switchCase.getExpressions(), 1);
			out.write(":");
		}
		writeClauseBody(switchCase, switchCase.getBody());
		return null;
	}

	@Override
	public Void visit(GoSelectCase selectCase) throws IOException {
		if (selectCase.isDefault()) {
			out.write("default:");
		} else {
			out.write("case ");
			selectCase.getCommunication().accept(new GoStatementFormattingVisitor(out));
			out.write(":");
		}
		writeClauseBody(selectCase, selectCase.getBody());
		return null;
	}

	@Override
	public Void visit(GoValueSpec valueSpec) throws IOException {
		FormattingTools.writeCommaSeparated(out, valueSpec.getNames(), n -> out.write(n.getName()));
		if (valueSpec.getType() != null) {
			out.write(" ");
			valueSpec.getType().accept(new GoTypeFormattingVisitor(out));
		}
		if (!valueSpec.getValues().isEmpty()) {
			out.write(" = ");
			new GoExpressionFormattingVisitor(out).writeExpressionList(valueSpec.getValues(), 1);
		}
		return null;
	}

	@Override
	public Void visit(GoTypeSpec typeSpec) throws IOException {
		out.write(typeSpec.getName());
		out.write(" ");
		if (typeSpec.isAlias()) {
			out.write("= ");
		}
		typeSpec.getType().accept(new GoTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoImportSpec importSpec) throws IOException {
		if (importSpec.getName() != null) {
			out.write(importSpec.getName());
			out.write(" ");
		}
		out.write(importSpec.getPath());
		return null;
	}

	@Override
	public Void visit(GoFunctionParameter functionParameter) throws IOException {
		if (!functionParameter.getNames().isEmpty()) {
			FormattingTools.writeCommaSeparated(out, functionParameter.getNames(), n -> out.write(n.getName()));
			out.write(" ");
		}
		if (functionParameter.isVariadic()) {
			out.write("...");
		}
		functionParameter.getType().accept(new GoTypeFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoStructTypeField structTypeField) throws IOException {
		if (!structTypeField.isEmbedded()) {
			FormattingTools.writeCommaSeparated(out, structTypeField.getNames(), n -> out.write(n.getName()));
			out.write(" ");
		}
		structTypeField.getType().accept(new GoTypeFormattingVisitor(out));
		if (structTypeField.getTag() != null) {
			out.write(" ");
			out.writeVerbatim(structTypeField.getTag());
		}
		return null;
	}

	@Override
	public Void visit(GoInterfaceTypeField interfaceTypeField) throws IOException {
		if (interfaceTypeField.getName() == null) {
			interfaceTypeField.getType().accept(new GoTypeFormattingVisitor(out));
			return null;
		}
		out.write(interfaceTypeField.getName());
		new GoTypeFormattingVisitor(out).writeSignature((GoFunctionType) interfaceTypeField.getType());
		return null;
	}

}
