package colongo.formatters;

import colongo.model.golang.*;
import colongo.model.golang.type.GoTypeName;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.util.List;

public class GoStatementFormattingVisitor extends GoStatementVisitor<Void, IOException> {

	private final GoSourceWriter out;

	public GoStatementFormattingVisitor(GoSourceWriter out) {
		this.out = out;
	}

	/**
	 * Writes each statement on a line of its own, with the comments and blank lines around it.
	 */
	public void writeStatements(List<GoStatement> statements) throws IOException {
		for (GoStatement statement : statements) {
			out.newLine();
			out.beginNode(statement.getLocation());
			statement.accept(this);
			out.endNode(statement.getLocation());
		}
	}

	public void writeBlock(GoBlock block) throws IOException {
		SourceLocation location = block.getLocation();
		out.write("{");
		if (!location.isUnknown()) {
			out.trailingComments(location.getStartLine());
		}
		try (IndentingWriter.Indent ignored = out.indent()) {
			writeStatements(block.getStatements());
			out.flushCommentsBefore(location);
		}
		out.newLine();
		out.write("}");
	}

	private static boolean isSimple(GoStatement statement) {
		return !(statement instanceof GoBlock || statement instanceof GoIf || statement instanceof GoFor ||
				statement instanceof GoForRange || statement instanceof GoSwitch ||
				statement instanceof GoTypeSwitch || statement instanceof GoSelect ||
				statement instanceof GoLabeledStatement);
	}

	/**
	 * Writes the body of a function. A body that was written on one line in the source stays on one
	 * line when it is short and holds only simple statements and no comments.
	 */
	public void writeFunctionBody(GoBlock body) throws IOException {
		SourceLocation location = body.getLocation();
		List<GoStatement> statements = body.getStatements();
		boolean oneLine = !location.isUnknown() && location.getStartLine() == location.getEndLine() &&
				statements.size() <= 5 && !out.hasCommentsWithin(location) &&
				statements.stream().allMatch(GoStatementFormattingVisitor::isSimple);
		if (!oneLine) {
			writeBlock(body);
			return;
		}
		out.write("{");
		if (!statements.isEmpty()) {
			out.write(" ");
			boolean first = true;
			for (GoStatement statement : statements) {
				if (!first) {
					out.write("; ");
				}
				first = false;
				statement.accept(this);
			}
			out.write(" ");
		}
		out.write("}");
	}

	private void writeExpression(GoExpression expression, int depth) throws IOException {
		expression.accept(new GoExpressionFormattingVisitor(out, 0, depth));
	}

	private static boolean isTypeName(GoExpression expression) {
		return expression instanceof GoVariableName || expression instanceof GoTypeName ||
				(expression instanceof GoSelectorExpression &&
						((GoSelectorExpression) expression).getExpression() instanceof GoVariableName);
	}

	// parentheses around a control clause expression may go, unless they protect a composite literal
	private static GoExpression stripParens(GoExpression expression) {
		if (!(expression instanceof GoParenthesizedExpression)) {
			return expression;
		}
		GoExpression inner = ((GoParenthesizedExpression) expression).getInner();
		boolean[] protectsLiteral = {false};
		GoWalker.walk(new GoInspector() {
			@Override
			public GoInspector inspect(GoNode node) {
				if (node instanceof GoParenthesizedExpression) {
					return null;
				}
				if (node instanceof GoCompositeLiteral) {
					GoExpression type = ((GoCompositeLiteral) node).getType();
					if (type != null && isTypeName(type)) {
						protectsLiteral[0] = true;
					}
					return null;
				}
				return this;
			}
		}, inner);
		if (protectsLiteral[0]) {
			return expression;
		}
		return stripParens(inner);
	}

	private void writeControlClause(boolean isFor, GoStatement init, GoExpression condition, GoStatement post)
			throws IOException {
		out.write(" ");
		boolean needsBlank = false;
		if (init == null && post == null) {
			if (condition != null) {
				writeExpression(stripParens(condition), 1);
				needsBlank = true;
			}
		} else {
			if (init != null) {
				init.accept(this);
			}
			out.write("; ");
			if (condition != null) {
				writeExpression(stripParens(condition), 1);
				needsBlank = true;
			}
			if (isFor) {
				out.write("; ");
				needsBlank = false;
				if (post != null) {
					post.accept(this);
					needsBlank = true;
				}
			}
		}
		if (needsBlank) {
			out.write(" ");
		}
	}

	private void writeCases(List<? extends GoNode> cases, SourceLocation location) throws IOException {
		out.write("{");
		if (!location.isUnknown()) {
			out.trailingComments(location.getStartLine());
		}
		for (GoNode c : cases) {
			out.newLine();
			out.beginNode(c.getLocation());
			c.accept(new GoNodeFormattingVisitor(out));
		}
		out.flushCommentsBefore(location);
		out.newLine();
		out.write("}");
	}

	@Override
	public Void visit(GoAssignmentStatement assignment) throws IOException {
		int depth = 1;
		if (assignment.getLhs().size() > 1 && assignment.getRhs().size() > 1) {
			++depth;
		}
		GoExpressionFormattingVisitor expressions = new GoExpressionFormattingVisitor(out);
		expressions.writeExpressionList(assignment.getLhs(), depth);
		out.write(" ");
		out.write(assignment.getOperator().getText());
		out.write(" ");
		expressions.writeExpressionList(assignment.getRhs(), depth);
		return null;
	}

	@Override
	public Void visit(GoIncDec incDec) throws IOException {
		writeExpression(incDec.getExpression(), 2);
		out.write(incDec.isInc() ? "++" : "--");
		return null;
	}

	@Override
	public Void visit(GoSend send) throws IOException {
		writeExpression(send.getChannel(), 1);
		out.write(" <- ");
		writeExpression(send.getValue(), 1);
		return null;
	}

	@Override
	public Void visit(GoExpressionStatement expressionStatement) throws IOException {
		writeExpression(expressionStatement.getExpression(), 1);
		return null;
	}

	@Override
	public Void visit(GoReturn goReturn) throws IOException {
		out.write("return");
		List<GoExpression> values = goReturn.getValues();
		if (values.isEmpty()) {
			return null;
		}
		out.write(" ");
		new GoExpressionFormattingVisitor(out).writeExpressionList(values, 1);
		return null;
	}

	@Override
	public Void visit(GoBlock block) throws IOException {
		writeBlock(block);
		return null;
	}

	@Override
	public Void visit(GoIf goIf) throws IOException {
		out.write("if");
		writeControlClause(false, goIf.getInit(), goIf.getCond(), null);
		writeBlock(goIf.getThen());
		GoStatement otherwise = goIf.getElse();
		if (otherwise != null) {
			out.write(" else ");
			otherwise.accept(this);
		}
		return null;
	}

	@Override
	public Void visit(GoFor goFor) throws IOException {
		out.write("for");
		writeControlClause(true, goFor.getInit(), goFor.getCondition(), goFor.getPost());
		writeBlock(goFor.getBody());
		return null;
	}

	@Override
	public Void visit(GoForRange forRange) throws IOException {
		out.write("for ");
		if (forRange.getKey() != null) {
			writeExpression(forRange.getKey(), 1);
			if (forRange.getValue() != null) {
				out.write(", ");
				writeExpression(forRange.getValue(), 1);
			}
			out.write(" ");
			out.write(forRange.getOperator().getText());
			out.write(" ");
		}
		out.write("range ");
		writeExpression(stripParens(forRange.getRangeExpr()), 1);
		out.write(" ");
		writeBlock(forRange.getBody());
		return null;
	}

	@Override
	public Void visit(GoSwitch goSwitch) throws IOException {
		out.write("switch");
		writeControlClause(false, goSwitch.getInit(), goSwitch.getTag(), null);
		writeCases(goSwitch.getCases(), goSwitch.getLocation());
		return null;
	}

	@Override
	public Void visit(GoTypeSwitch typeSwitch) throws IOException {
		out.write("switch");
		if (typeSwitch.getInit() != null) {
			out.write(" ");
			typeSwitch.getInit().accept(this);
			out.write(";");
		}
		out.write(" ");
		typeSwitch.getGuard().accept(this);
		out.write(" ");
		writeCases(typeSwitch.getCases(), typeSwitch.getLocation());
		return null;
	}

	@Override
	public Void visit(GoSelect select) throws IOException {
		out.write("select ");
		writeCases(select.getCases(), select.getLocation());
		return null;
	}

	@Override
	public Void visit(GoLabeledStatement labeledStatement) throws IOException {
		// labels sit one level left of the statements around them
		int outdent = out.getIndentation() > 0 ? -1 : 0;
		try (IndentingWriter.Indent ignored = out.indent(outdent)) {
			out.write(labeledStatement.getLabel());
			out.write(":");
		}
		GoStatement statement = labeledStatement.getStatement();
		if (statement instanceof GoEmptyStatement) {
			return null;
		}
		out.newLine();
		out.beginNode(statement.getLocation());
		statement.accept(this);
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
	public Void visit(GoTo goTo) throws IOException {
		out.write("goto ");
		out.write(goTo.getLabel());
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
		writeExpression(defer.getExpression(), 1);
		return null;
	}

	@Override
	public Void visit(GoRoutineStatement go) throws IOException {
		out.write("go ");
		writeExpression(go.getExpression(), 1);
		return null;
	}

	@Override
	public Void visit(GoDeclarationStatement declarationStatement) throws IOException {
		declarationStatement.getDeclaration().accept(new GoDeclarationFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoEmptyStatement emptyStatement) throws IOException {
		return null;
	}

}
