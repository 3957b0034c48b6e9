package colongo.model.golang;

import colongo.InternalCompilerError;

import java.util.List;

public class GoASTUtils {
	private GoASTUtils() {}

	/**
	 * Finds a statement in a statement list by identity rather than by structural equality: two
	 * separately written "x = 1" statements are equal but are not the same statement.
	 */
	public static int indexOfStatement(List<GoStatement> statements, GoStatement statement) {
		for (int i = 0; i < statements.size(); ++i) {
			if (statements.get(i) == statement) {
				return i;
			}
		}
		throw new InternalCompilerError("statement not found in its enclosing statement list");
	}

	/**
	 * @return whether the expression is the blank identifier "_"
	 */
	public static boolean isBlank(GoExpression expression) {
		return expression instanceof GoVariableName && ((GoVariableName) expression).getName().equals("_");
	}

}
