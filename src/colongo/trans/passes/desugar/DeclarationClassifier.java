package colongo.trans.passes.desugar;

import colongo.model.golang.GoASTUtils;
import colongo.model.golang.GoExpression;
import colongo.model.golang.GoVariableName;

import java.util.ArrayList;
import java.util.List;

public class DeclarationClassifier {
	private DeclarationClassifier() {}

	/**
	 * Classifies the targets of an assignment or range clause. Colon-prefixed names lose their
	 * colon here, so the names are final once this returns.
	 *
	 * @param targets the left-hand side; null entries stand for a missing range key or value
	 */
	public static Classification classify(List<GoExpression> targets) {
		List<DeclarationKind> kinds = new ArrayList<>(targets.size());
		for (GoExpression target : targets) {
			kinds.add(classify(target));
		}
		return new Classification(kinds);
	}

	private static DeclarationKind classify(GoExpression target) {
		if (target == null) {
			return DeclarationKind.IGNORED;
		}
		if (!(target instanceof GoVariableName)) {
			return DeclarationKind.REASSIGN;
		}
		GoVariableName name = (GoVariableName) target;
		if (name.getName().startsWith(":")) {
			name.setName(name.getName().substring(1));
			return DeclarationKind.DECLARE;
		}
		if (GoASTUtils.isBlank(name)) {
			return DeclarationKind.IGNORED;
		}
		return DeclarationKind.REASSIGN;
	}

}
