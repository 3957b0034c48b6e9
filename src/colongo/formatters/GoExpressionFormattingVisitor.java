package colongo.formatters;

import colongo.model.golang.*;
import colongo.model.golang.type.GoFunctionType;
import colongo.model.golang.type.GoType;
import colongo.util.SourceLocation;

import java.io.IOException;
import java.util.List;

import static colongo.lexer.GoTokenType.HIGHEST_PRECEDENCE;
import static colongo.lexer.GoTokenType.LOWEST_PRECEDENCE;
import static colongo.lexer.GoTokenType.UNARY_PRECEDENCE;

/**
 * Prints expressions with gofmt's spacing.
 *
 * The precedence is the binding strength the context requires of the expression, and the depth
 * counts how deeply the expression is nested in argument lists and operands; together they decide
 * where binary operators get blanks (see {@link GoBinopFormattingVisitor}).
 */
public class GoExpressionFormattingVisitor extends GoExpressionVisitor<Void, IOException> {

	private final GoSourceWriter out;
	private final int precedence;
	private final int depth;

	public GoExpressionFormattingVisitor(GoSourceWriter out) {
		this(out, LOWEST_PRECEDENCE, 1);
	}

	public GoExpressionFormattingVisitor(GoSourceWriter out, int precedence, int depth) {
		this.out = out;
		this.precedence = precedence;
		this.depth = depth;
	}

	static int reduceDepth(int depth) {
		return Integer.max(depth - 1, 1);
	}

	public void writeExpressionList(List<GoExpression> expressions, int listDepth) throws IOException {
		FormattingTools.writeCommaSeparated(out, expressions,
				e -> e.accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, listDepth)));
	}

	/**
	 * Writes the elements of a call or composite literal, keeping the line breaks of the source. The
	 * elements after the first break are indented once, and a break before the closing token gets a
	 * trailing comma.
	 */
	private void writeList(String open, List<GoExpression> elements, GoLineBreaks lineBreaks, int openLine,
	                       SourceLocation closing, int listDepth, boolean alignPairs, boolean ellipsis,
	                       String close) throws IOException {
		out.write(open);
		if (lineBreaks.hasBreaks()) {
			out.setLastLine(Integer.max(out.getLastLine(), openLine));
		}
		boolean indented = false;
		for (int i = 0; i < elements.size(); ++i) {
			GoExpression element = elements.get(i);
			boolean breakBefore = lineBreaks.isBreakBefore(i);
			if (i > 0) {
				out.write(",");
				if (breakBefore) {
					out.endNode(elements.get(i - 1).getLocation());
				} else {
					out.write(" ");
				}
			}
			if (breakBefore) {
				if (!indented) {
					out.indent();
					indented = true;
				}
				out.newLine();
				out.beginNode(element.getLocation());
			}
			if (alignPairs && breakBefore && elements.size() > 1 && element instanceof GoKeyValue) {
				GoKeyValue pair = (GoKeyValue) element;
				pair.getKey().accept(new GoExpressionFormattingVisitor(out));
				out.write(":");
				out.writeCellBreak();
				pair.getValue().accept(new GoExpressionFormattingVisitor(out));
			} else {
				element.accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, listDepth));
			}
		}
		if (ellipsis) {
			out.write("...");
		}
		if (lineBreaks.isBreakBeforeClose()) {
			out.write(",");
			if (!elements.isEmpty()) {
				out.endNode(elements.get(elements.size() - 1).getLocation());
			}
			out.flushCommentsBefore(closing);
			if (indented) {
				out.unindent(1);
				indented = false;
			}
			out.newLine();
		}
		if (indented) {
			out.unindent(1);
		}
		out.write(close);
	}

	@Override
	public Void visit(GoVariableName v) throws IOException {
		out.write(v.getName());
		return null;
	}

	@Override
	public Void visit(GoBasicLiteral basicLiteral) throws IOException {
		// raw strings may span lines
		out.writeVerbatim(basicLiteral.getValue());
		return null;
	}

	@Override
	public Void visit(GoCompositeLiteral compositeLiteral) throws IOException {
		GoExpression type = compositeLiteral.getType();
		int openLine = compositeLiteral.getLocation().getStartLine();
		if (type != null) {
			type.accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, depth));
			openLine = type.getLocation().getEndLine();
		}
		writeList("{", compositeLiteral.getElements(), compositeLiteral.getLineBreaks(), openLine,
				compositeLiteral.getLocation(), 1, true, false, "}");
		return null;
	}

	@Override
	public Void visit(GoKeyValue keyValue) throws IOException {
		keyValue.getKey().accept(new GoExpressionFormattingVisitor(out));
		out.write(": ");
		keyValue.getValue().accept(new GoExpressionFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(GoAnonymousFunction anonymousFunction) throws IOException {
		out.write("func");
		new GoTypeFormattingVisitor(out).writeSignature(anonymousFunction.getSignature());
		out.write(" ");
		new GoStatementFormattingVisitor(out).writeFunctionBody(anonymousFunction.getBody());
		return null;
	}

	@Override
	public Void visit(GoParenthesizedExpression parenthesizedExpression) throws IOException {
		GoExpression inner = parenthesizedExpression.getInner();
		if (inner instanceof GoParenthesizedExpression) {
			// one pair of parentheses is enough
			inner.accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, depth));
			return null;
		}
		out.write("(");
		inner.accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, reduceDepth(depth)));
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoSelectorExpression dot) throws IOException {
		dot.getExpression().accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, depth));
		out.write(".");
		out.write(dot.getName());
		return null;
	}

	@Override
	public Void visit(GoIndexExpression index) throws IOException {
		index.getTarget().accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, 1));
		out.write("[");
		index.getIndex().accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, depth + 1));
		out.write("]");
		return null;
	}

	@Override
	public Void visit(GoSliceOperator slice) throws IOException {
		slice.getTarget().accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, 1));
		out.write("[");
		GoExpression[] indices = slice.getMax() == null
				? new GoExpression[]{slice.getLow(), slice.getHigh()}
				: new GoExpression[]{slice.getLow(), slice.getHigh(), slice.getMax()};
		boolean needsBlanks = false;
		if (depth <= 1) {
			int indexCount = 0;
			boolean hasBinaries = false;
			for (GoExpression e : indices) {
				if (e != null) {
					++indexCount;
					if (e instanceof GoBinop) {
						hasBinaries = true;
					}
				}
			}
			needsBlanks = indexCount > 1 && hasBinaries;
		}
		for (int i = 0; i < indices.length; ++i) {
			if (i > 0) {
				if (indices[i - 1] != null && needsBlanks) {
					out.write(" ");
				}
				out.write(":");
				if (indices[i] != null && needsBlanks) {
					out.write(" ");
				}
			}
			if (indices[i] != null) {
				indices[i].accept(new GoExpressionFormattingVisitor(out, LOWEST_PRECEDENCE, depth + 1));
			}
		}
		out.write("]");
		return null;
	}

	@Override
	public Void visit(GoTypeAssertion typeAssertion) throws IOException {
		typeAssertion.getExpression().accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, depth));
		out.write(".(");
		if (typeAssertion.getType() == null) {
			out.write("type");
		} else {
			typeAssertion.getType().accept(new GoTypeFormattingVisitor(out));
		}
		out.write(")");
		return null;
	}

	@Override
	public Void visit(GoCall call) throws IOException {
		int callDepth = depth;
		if (call.getArguments().size() > 1) {
			++callDepth;
		}
		GoExpression function = call.getFunction();
		if (function instanceof GoFunctionType) {
			// conversions to function types need parentheses
			out.write("(");
			function.accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, callDepth));
			out.write(")");
		} else {
			function.accept(new GoExpressionFormattingVisitor(out, HIGHEST_PRECEDENCE, callDepth));
		}
		writeList("(", call.getArguments(), call.getLineBreaks(), function.getLocation().getEndLine(),
				call.getLocation(), callDepth, false, call.hasEllipsis(), ")");
		return null;
	}

	// operators that would scan as a different token when written next to each other
	private static boolean mayCombine(GoUnary.Operation operation, GoExpression target) {
		if (!(target instanceof GoUnary)) {
			return false;
		}
		char next = ((GoUnary) target).getOperation().getText().charAt(0);
		switch (operation) {
			case POS:
				return next == '+';
			case NEG:
				return next == '-';
			case ADDR:
				return next == '&' || next == '^';
			default:
				return false;
		}
	}

	@Override
	public Void visit(GoUnary unary) throws IOException {
		if (UNARY_PRECEDENCE < precedence) {
			out.write("(");
			unary.accept(new GoExpressionFormattingVisitor(out));
			out.write(")");
			return null;
		}
		out.write(unary.getOperation().getText());
		if (mayCombine(unary.getOperation(), unary.getTarget())) {
			out.write(" ");
		}
		unary.getTarget().accept(new GoExpressionFormattingVisitor(out, UNARY_PRECEDENCE, depth));
		return null;
	}

	@Override
	public Void visit(GoBinop binop) throws IOException {
		binop.accept(new GoBinopFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoType type) throws IOException {
		type.accept(new GoTypeFormattingVisitor(out));
		return null;
	}

}
