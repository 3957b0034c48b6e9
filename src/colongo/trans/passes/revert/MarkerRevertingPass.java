package colongo.trans.passes.revert;

import colongo.model.golang.*;
import colongo.model.golang.type.GoTypeName;

/**
 * Undoes the encoding made before parsing: tagged identifiers get their colon back, and every
 * ":=" becomes "=" again, since the input never contains ":=" of its own.
 */
public class MarkerRevertingPass {
	private MarkerRevertingPass() {}

	private static String revert(String name, String declarationTag) {
		if (name.startsWith(declarationTag)) {
			return ":" + name.substring(declarationTag.length());
		}
		return name;
	}

	// the type name may be qualified by its package
	private static String revertTypeName(String name, String declarationTag) {
		int dot = name.indexOf('.');
		if (dot < 0) {
			return revert(name, declarationTag);
		}
		return name.substring(0, dot + 1) + revert(name.substring(dot + 1), declarationTag);
	}

	public static void perform(GoNode root, String declarationTag) {
		GoWalker.walk(new GoInspector() {
			@Override
			public GoInspector inspect(GoNode node) {
				if (node instanceof GoAssignmentStatement) {
					GoAssignmentStatement assignment = (GoAssignmentStatement) node;
					if (assignment.getOperator() == GoAssignmentStatement.Operator.DEFINE) {
						assignment.setOperator(GoAssignmentStatement.Operator.ASSIGN);
					}
				} else if (node instanceof GoForRange) {
					GoForRange forRange = (GoForRange) node;
					if (forRange.getOperator() == GoAssignmentStatement.Operator.DEFINE) {
						forRange.setOperator(GoAssignmentStatement.Operator.ASSIGN);
					}
				} else if (node instanceof GoVariableName) {
					GoVariableName variableName = (GoVariableName) node;
					variableName.setName(revert(variableName.getName(), declarationTag));
				} else if (node instanceof GoTypeName) {
					GoTypeName typeName = (GoTypeName) node;
					typeName.setName(revertTypeName(typeName.getName(), declarationTag));
				} else if (node instanceof GoSelectorExpression) {
					GoSelectorExpression selector = (GoSelectorExpression) node;
					selector.setName(revert(selector.getName(), declarationTag));
				}
				return this;
			}
		}, root);
	}

}
