package colongo.model.golang;

import colongo.model.golang.type.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first traversal of a Go tree in source order.
 */
public class GoWalker {
	private GoWalker() {}

	public static void walk(GoInspector inspector, GoNode node) {
		GoInspector childInspector = inspector.inspect(node);
		if (childInspector == null) {
			return;
		}
		for (GoNode child : children(node)) {
			walk(childInspector, child);
		}
	}

	/**
	 * @return the direct children of a node in source order, skipping absent optional parts
	 */
	public static List<GoNode> children(GoNode node) {
		List<GoNode> result = new ArrayList<>();
		node.accept(new ChildrenVisitor(result));
		return result;
	}

	private static void add(List<GoNode> result, GoNode node) {
		if (node != null) {
			result.add(node);
		}
	}

	private static void addAll(List<GoNode> result, List<? extends GoNode> nodes) {
		if (nodes != null) {
			for (GoNode node : nodes) {
				add(result, node);
			}
		}
	}

	private static class ChildrenVisitor extends GoNodeVisitor<Void, RuntimeException> {
		private final List<GoNode> result;

		ChildrenVisitor(List<GoNode> result) {
			this.result = result;
		}

		@Override
		public Void visit(GoModule module) {
			addAll(result, module.getDeclarations());
			return null;
		}

		@Override
		public Void visit(GoComment comment) {
			return null;
		}

		@Override
		public Void visit(GoStatement statement) {
			statement.accept(new StatementChildrenVisitor(result));
			return null;
		}

		@Override
		public Void visit(GoDeclaration declaration) {
			declaration.accept(new DeclarationChildrenVisitor(result));
			return null;
		}

		@Override
		public Void visit(GoExpression expression) {
			expression.accept(new ExpressionChildrenVisitor(result));
			return null;
		}

		@Override
		public Void visit(GoSwitchCase switchCase) {
			addAll(result, switchCase.getExpressions());
			addAll(result, switchCase.getBody());
			return null;
		}

		@Override
		public Void visit(GoSelectCase selectCase) {
			add(result, selectCase.getCommunication());
			addAll(result, selectCase.getBody());
			return null;
		}

		@Override
		public Void visit(GoValueSpec valueSpec) {
			addAll(result, valueSpec.getNames());
			add(result, valueSpec.getType());
			addAll(result, valueSpec.getValues());
			return null;
		}

		@Override
		public Void visit(GoTypeSpec typeSpec) {
			add(result, typeSpec.getType());
			return null;
		}

		@Override
		public Void visit(GoImportSpec importSpec) {
			return null;
		}

		@Override
		public Void visit(GoFunctionParameter functionParameter) {
			addAll(result, functionParameter.getNames());
			add(result, functionParameter.getType());
			return null;
		}

		@Override
		public Void visit(GoStructTypeField structTypeField) {
			addAll(result, structTypeField.getNames());
			add(result, structTypeField.getType());
			return null;
		}

		@Override
		public Void visit(GoInterfaceTypeField interfaceTypeField) {
			add(result, interfaceTypeField.getType());
			return null;
		}
	}

	private static class DeclarationChildrenVisitor extends GoDeclarationVisitor<Void, RuntimeException> {
		private final List<GoNode> result;

		DeclarationChildrenVisitor(List<GoNode> result) {
			this.result = result;
		}

		@Override
		public Void visit(GoFunctionDeclaration functionDeclaration) {
			add(result, functionDeclaration.getReceiver());
			add(result, functionDeclaration.getSignature());
			add(result, functionDeclaration.getBody());
			return null;
		}

		@Override
		public Void visit(GoVariableDeclaration variableDeclaration) {
			addAll(result, variableDeclaration.getSpecs());
			return null;
		}

		@Override
		public Void visit(GoTypeDeclaration typeDeclaration) {
			addAll(result, typeDeclaration.getSpecs());
			return null;
		}

		@Override
		public Void visit(GoImportDeclaration importDeclaration) {
			addAll(result, importDeclaration.getSpecs());
			return null;
		}
	}

	private static class StatementChildrenVisitor extends GoStatementVisitor<Void, RuntimeException> {
		private final List<GoNode> result;

		StatementChildrenVisitor(List<GoNode> result) {
			this.result = result;
		}

		@Override
		public Void visit(GoAssignmentStatement assignment) {
			addAll(result, assignment.getLhs());
			addAll(result, assignment.getRhs());
			return null;
		}

		@Override
		public Void visit(GoIncDec incDec) {
			add(result, incDec.getExpression());
			return null;
		}

		@Override
		public Void visit(GoSend send) {
			add(result, send.getChannel());
			add(result, send.getValue());
			return null;
		}

		@Override
		public Void visit(GoExpressionStatement expressionStatement) {
			add(result, expressionStatement.getExpression());
			return null;
		}

		@Override
		public Void visit(GoReturn goReturn) {
			addAll(result, goReturn.getValues());
			return null;
		}

		@Override
		public Void visit(GoBlock block) {
			addAll(result, block.getStatements());
			return null;
		}

		@Override
		public Void visit(GoIf goIf) {
			add(result, goIf.getInit());
			add(result, goIf.getCond());
			add(result, goIf.getThen());
			add(result, goIf.getElse());
			return null;
		}

		@Override
		public Void visit(GoFor goFor) {
			add(result, goFor.getInit());
			add(result, goFor.getCondition());
			add(result, goFor.getPost());
			add(result, goFor.getBody());
			return null;
		}

		@Override
		public Void visit(GoForRange forRange) {
			add(result, forRange.getKey());
			add(result, forRange.getValue());
			add(result, forRange.getRangeExpr());
			add(result, forRange.getBody());
			return null;
		}

		@Override
		public Void visit(GoSwitch goSwitch) {
			add(result, goSwitch.getInit());
			add(result, goSwitch.getTag());
			addAll(result, goSwitch.getCases());
			return null;
		}

		@Override
		public Void visit(GoTypeSwitch typeSwitch) {
			add(result, typeSwitch.getInit());
			add(result, typeSwitch.getGuard());
			addAll(result, typeSwitch.getCases());
			return null;
		}

		@Override
		public Void visit(GoSelect select) {
			addAll(result, select.getCases());
			return null;
		}

		@Override
		public Void visit(GoLabeledStatement labeledStatement) {
			add(result, labeledStatement.getStatement());
			return null;
		}

		@Override
		public Void visit(GoBreak break1) {
			return null;
		}

		@Override
		public Void visit(GoContinue continue1) {
			return null;
		}

		@Override
		public Void visit(GoTo goTo) {
			return null;
		}

		@Override
		public Void visit(GoFallthrough fallthrough) {
			return null;
		}

		@Override
		public Void visit(GoDefer defer) {
			add(result, defer.getExpression());
			return null;
		}

		@Override
		public Void visit(GoRoutineStatement go) {
			add(result, go.getExpression());
			return null;
		}

		@Override
		public Void visit(GoDeclarationStatement declarationStatement) {
			add(result, declarationStatement.getDeclaration());
			return null;
		}

		@Override
		public Void visit(GoEmptyStatement emptyStatement) {
			return null;
		}
	}

	private static class ExpressionChildrenVisitor extends GoExpressionVisitor<Void, RuntimeException> {
		private final List<GoNode> result;

		ExpressionChildrenVisitor(List<GoNode> result) {
			this.result = result;
		}

		@Override
		public Void visit(GoVariableName v) {
			return null;
		}

		@Override
		public Void visit(GoBasicLiteral basicLiteral) {
			return null;
		}

		@Override
		public Void visit(GoCompositeLiteral compositeLiteral) {
			add(result, compositeLiteral.getType());
			addAll(result, compositeLiteral.getElements());
			return null;
		}

		@Override
		public Void visit(GoKeyValue keyValue) {
			add(result, keyValue.getKey());
			add(result, keyValue.getValue());
			return null;
		}

		@Override
		public Void visit(GoAnonymousFunction anonymousFunction) {
			add(result, anonymousFunction.getSignature());
			add(result, anonymousFunction.getBody());
			return null;
		}

		@Override
		public Void visit(GoParenthesizedExpression parenthesizedExpression) {
			add(result, parenthesizedExpression.getInner());
			return null;
		}

		@Override
		public Void visit(GoSelectorExpression dot) {
			add(result, dot.getExpression());
			return null;
		}

		@Override
		public Void visit(GoIndexExpression index) {
			add(result, index.getTarget());
			add(result, index.getIndex());
			return null;
		}

		@Override
		public Void visit(GoSliceOperator slice) {
			add(result, slice.getTarget());
			add(result, slice.getLow());
			add(result, slice.getHigh());
			add(result, slice.getMax());
			return null;
		}

		@Override
		public Void visit(GoTypeAssertion typeAssertion) {
			add(result, typeAssertion.getExpression());
			add(result, typeAssertion.getType());
			return null;
		}

		@Override
		public Void visit(GoCall call) {
			add(result, call.getFunction());
			addAll(result, call.getArguments());
			return null;
		}

		@Override
		public Void visit(GoUnary unary) {
			add(result, unary.getTarget());
			return null;
		}

		@Override
		public Void visit(GoBinop binop) {
			add(result, binop.getLHS());
			add(result, binop.getRHS());
			return null;
		}

		@Override
		public Void visit(GoType type) {
			type.accept(new TypeChildrenVisitor(result));
			return null;
		}
	}

	private static class TypeChildrenVisitor extends GoTypeVisitor<Void, RuntimeException> {
		private final List<GoNode> result;

		TypeChildrenVisitor(List<GoNode> result) {
			this.result = result;
		}

		@Override
		public Void visit(GoTypeName typeName) {
			return null;
		}

		@Override
		public Void visit(GoPtrType ptrType) {
			add(result, ptrType.getElementType());
			return null;
		}

		@Override
		public Void visit(GoSliceType sliceType) {
			add(result, sliceType.getElementType());
			return null;
		}

		@Override
		public Void visit(GoArrayType arrayType) {
			add(result, arrayType.getLength());
			add(result, arrayType.getElementType());
			return null;
		}

		@Override
		public Void visit(GoMapType mapType) {
			add(result, mapType.getKeyType());
			add(result, mapType.getValueType());
			return null;
		}

		@Override
		public Void visit(GoChanType chanType) {
			add(result, chanType.getElementType());
			return null;
		}

		@Override
		public Void visit(GoFunctionType functionType) {
			addAll(result, functionType.getParameters());
			addAll(result, functionType.getResults());
			return null;
		}

		@Override
		public Void visit(GoStructType structType) {
			addAll(result, structType.getFields());
			return null;
		}

		@Override
		public Void visit(GoInterfaceType interfaceType) {
			addAll(result, interfaceType.getFields());
			return null;
		}
	}

}
