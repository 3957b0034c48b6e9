package colongo.formatters;

import colongo.model.golang.*;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.util.List;

public class GoDeclarationFormattingVisitor extends GoDeclarationVisitor<Void, IOException> {

	private final GoSourceWriter out;

	public GoDeclarationFormattingVisitor(GoSourceWriter out) {
		this.out = out;
	}

	private interface SpecFormatter<T> {
		/**
		 * @return how many aligned columns the spec left empty before a trailing comment
		 */
		int format(T spec, int index) throws IOException;
	}

	private <T extends GoNode> void writeGroup(SourceLocation location, List<T> specs, SpecFormatter<T> formatter)
			throws IOException {
		out.write("(");
		if (!specs.isEmpty()) {
			if (!location.isUnknown()) {
				out.trailingComments(location.getStartLine());
			}
			try (IndentingWriter.Indent ignored = out.indent()) {
				for (int i = 0; i < specs.size(); ++i) {
					T spec = specs.get(i);
					out.newLine();
					out.beginNode(spec.getLocation());
					int extraTabs = formatter.format(spec, i);
					out.endNode(spec.getLocation(), extraTabs);
				}
				out.flushCommentsBefore(location);
			}
			out.newLine();
		}
		out.write(")");
	}

	/**
	 * For each spec, whether its type column is kept although the spec has no type: within a run of
	 * specs with values, the column stays if any spec of the run has a type.
	 */
	static boolean[] keepTypeColumn(List<GoValueSpec> specs) {
		boolean[] keep = new boolean[specs.size()];
		int runStart = -1;
		boolean keepType = false;
		for (int i = 0; i < specs.size(); ++i) {
			GoValueSpec spec = specs.get(i);
			if (!spec.getValues().isEmpty()) {
				if (runStart < 0) {
					runStart = i;
					keepType = false;
				}
			} else if (runStart >= 0) {
				fill(keep, runStart, i, keepType);
				runStart = -1;
			}
			if (spec.getType() != null) {
				keepType = true;
			}
		}
		if (runStart >= 0) {
			fill(keep, runStart, specs.size(), keepType);
		}
		return keep;
	}

	private static void fill(boolean[] keep, int from, int to, boolean value) {
		if (value) {
			for (int i = from; i < to; ++i) {
				keep[i] = true;
			}
		}
	}

	private int writeAlignedValueSpec(GoValueSpec spec, boolean keepType) throws IOException {
		FormattingTools.writeCommaSeparated(out, spec.getNames(), n -> out.write(n.getName()));
		int extraTabs = 3;
		if (spec.getType() != null || keepType) {
			out.writeCellBreak();
			--extraTabs;
		}
		if (spec.getType() != null) {
			spec.getType().accept(new GoTypeFormattingVisitor(out));
		}
		if (!spec.getValues().isEmpty()) {
			out.writeCellBreak();
			out.write("= ");
			new GoExpressionFormattingVisitor(out).writeExpressionList(spec.getValues(), 1);
			--extraTabs;
		}
		return extraTabs;
	}

	@Override
	public Void visit(GoFunctionDeclaration functionDeclaration) throws IOException {
		out.write("func ");
		GoTypeFormattingVisitor types = new GoTypeFormattingVisitor(out);
		if (functionDeclaration.getReceiver() != null) {
			out.write("(");
			functionDeclaration.getReceiver().accept(new GoNodeFormattingVisitor(out));
			out.write(") ");
		}
		out.write(functionDeclaration.getName());
		types.writeSignature(functionDeclaration.getSignature());
		if (functionDeclaration.getBody() != null) {
			out.write(" ");
			new GoStatementFormattingVisitor(out).writeFunctionBody(functionDeclaration.getBody());
		}
		return null;
	}

	@Override
	public Void visit(GoVariableDeclaration variableDeclaration) throws IOException {
		out.write(variableDeclaration.isConstant() ? "const " : "var ");
		List<GoValueSpec> specs = variableDeclaration.getSpecs();
		if (!variableDeclaration.isGrouped() && specs.size() == 1) {
			specs.get(0).accept(new GoNodeFormattingVisitor(out));
			return null;
		}
		if (specs.size() > 1) {
			boolean[] keepType = keepTypeColumn(specs);
			writeGroup(variableDeclaration.getLocation(), specs,
					(spec, i) -> writeAlignedValueSpec(spec, keepType[i]));
		} else {
			writeGroup(variableDeclaration.getLocation(), specs, (spec, i) -> {
				spec.accept(new GoNodeFormattingVisitor(out));
				return 0;
			});
		}
		return null;
	}

	@Override
	public Void visit(GoTypeDeclaration typeDeclaration) throws IOException {
		out.write("type ");
		List<GoTypeSpec> specs = typeDeclaration.getSpecs();
		if (!typeDeclaration.isGrouped() && specs.size() == 1) {
			specs.get(0).accept(new GoNodeFormattingVisitor(out));
			return null;
		}
		boolean align = specs.size() > 1;
		writeGroup(typeDeclaration.getLocation(), specs, (spec, i) -> {
			out.write(spec.getName());
			if (align) {
				out.writeCellBreak();
			} else {
				out.write(" ");
			}
			if (spec.isAlias()) {
				out.write("= ");
			}
			spec.getType().accept(new GoTypeFormattingVisitor(out));
			return 0;
		});
		return null;
	}

	@Override
	public Void visit(GoImportDeclaration importDeclaration) throws IOException {
		out.write("import ");
		List<GoImportSpec> specs = importDeclaration.getSpecs();
		if (!importDeclaration.isGrouped() && specs.size() == 1) {
			specs.get(0).accept(new GoNodeFormattingVisitor(out));
			return null;
		}
		writeGroup(importDeclaration.getLocation(), specs, (spec, i) -> {
			spec.accept(new GoNodeFormattingVisitor(out));
			return 0;
		});
		return null;
	}

}
