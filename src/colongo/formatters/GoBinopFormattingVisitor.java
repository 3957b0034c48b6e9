package colongo.formatters;

import colongo.model.golang.*;
import colongo.model.golang.type.GoType;

import java.io.IOException;

import static colongo.lexer.GoTokenType.LOWEST_PRECEDENCE;

/**
 * Prints binary expressions. Blanks around an operator are dropped when its precedence is at or
 * above a cutoff, so that {@code a*b + c} shows its structure; the cutoff is lower for deeply nested
 * expressions, where compact operands read better. A line break in the source after an operator is
 * kept, and the operand after it is indented once.
 */
public class GoBinopFormattingVisitor extends GoExpressionVisitor<Void, IOException> {

	private final GoSourceWriter out;
	private final int precedence;
	private final int depth;

	public GoBinopFormattingVisitor(GoSourceWriter out, int precedence, int depth) {
		this.out = out;
		this.precedence = precedence;
		this.depth = depth;
	}

	private static final class Shape {
		boolean has4;
		boolean has5;
		// the precedence above which blanks are needed to keep tokens apart, 0 if none
		int maxProblem;
	}

	private static void walkBinary(GoBinop e, Shape shape) {
		switch (e.getOperation().getPrecedence()) {
			case 4:
				shape.has4 = true;
				break;
			case 5:
				shape.has5 = true;
				break;
		}
		if (e.getLHS() instanceof GoBinop) {
			GoBinop l = (GoBinop) e.getLHS();
			if (l.getOperation().getPrecedence() >= e.getOperation().getPrecedence()) {
				walkBinary(l, shape);
			}
		}
		if (e.getRHS() instanceof GoBinop) {
			GoBinop r = (GoBinop) e.getRHS();
			if (r.getOperation().getPrecedence() > e.getOperation().getPrecedence()) {
				walkBinary(r, shape);
			}
		} else if (e.getRHS() instanceof GoUnary) {
			switch (e.getOperation().getText() + ((GoUnary) e.getRHS()).getOperation().getText()) {
				case "/*":
				case "&&":
				case "&^":
					shape.maxProblem = 5;
					break;
				case "++":
				case "--":
					shape.maxProblem = Integer.max(shape.maxProblem, 4);
					break;
			}
		}
	}

	static int cutoff(GoBinop e, int depth) {
		Shape shape = new Shape();
		walkBinary(e, shape);
		if (shape.maxProblem > 0) {
			return shape.maxProblem + 1;
		}
		if (shape.has4 && shape.has5) {
			return depth == 1 ? 5 : 4;
		}
		return depth == 1 ? 6 : 4;
	}

	private static int diffPrecedence(GoExpression e, int precedence) {
		if (e instanceof GoBinop && ((GoBinop) e).getOperation().getPrecedence() == precedence) {
			return 0;
		}
		return 1;
	}

	@Override
	public Void visit(GoBinop binop) throws IOException {
		int prec = binop.getOperation().getPrecedence();
		if (prec < precedence) {
			out.write("(");
			binop.accept(new GoBinopFormattingVisitor(out, LOWEST_PRECEDENCE,
					GoExpressionFormattingVisitor.reduceDepth(depth)));
			out.write(")");
			return null;
		}
		boolean printBlank = prec < cutoff(binop, depth);
		GoExpression lhs = binop.getLHS();
		lhs.accept(new GoExpressionFormattingVisitor(out, prec, depth + diffPrecedence(lhs, prec)));
		if (printBlank) {
			out.write(" ");
		}
		out.write(binop.getOperation().getText());
		if (binop.hasLineBreak()) {
			try (IndentingWriter.Indent ignored = out.indent()) {
				out.newLine();
				binop.getRHS().accept(new GoExpressionFormattingVisitor(out, prec + 1, depth + 1));
			}
			return null;
		}
		if (printBlank) {
			out.write(" ");
		}
		binop.getRHS().accept(new GoExpressionFormattingVisitor(out, prec + 1, depth + 1));
		return null;
	}

	@Override
	public Void visit(GoVariableName v) throws IOException {
		v.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoBasicLiteral basicLiteral) throws IOException {
		basicLiteral.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoCompositeLiteral compositeLiteral) throws IOException {
		compositeLiteral.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoKeyValue keyValue) throws IOException {
		keyValue.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoAnonymousFunction anonymousFunction) throws IOException {
		anonymousFunction.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoParenthesizedExpression parenthesizedExpression) throws IOException {
		parenthesizedExpression.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoSelectorExpression dot) throws IOException {
		dot.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoIndexExpression index) throws IOException {
		index.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoSliceOperator slice) throws IOException {
		slice.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoTypeAssertion typeAssertion) throws IOException {
		typeAssertion.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoCall call) throws IOException {
		call.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoUnary unary) throws IOException {
		unary.accept(new GoExpressionFormattingVisitor(out, precedence, depth));
		return null;
	}

	@Override
	public Void visit(GoType type) throws IOException {
		type.accept(new GoTypeFormattingVisitor(out));
		return null;
	}

}
