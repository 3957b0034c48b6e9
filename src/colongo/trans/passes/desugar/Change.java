package colongo.trans.passes.desugar;

import colongo.model.golang.*;
import colongo.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rewrite of one assignment statement that declares names, recorded while walking the tree
 * and applied once the walk is over, so that statement lists are not modified while they are
 * being traversed.
 */
public class Change {

	private final GoAssignmentStatement assignment;
	private final Classification classification;
	private final List<GoStatement> statements;
	private final GoLabeledStatement labelSlot;
	private final GoStatement reference;

	/**
	 * @param classification the targets' classification when the assignment is mixed, null when it only declares
	 * @param statements the statement list that holds the assignment, or the outermost label around it
	 * @param labelSlot the label directly around the assignment, if any
	 * @param reference the member of the statement list after which new statements go
	 */
	public Change(GoAssignmentStatement assignment, Classification classification, List<GoStatement> statements,
	              GoLabeledStatement labelSlot, GoStatement reference) {
		this.assignment = assignment;
		this.classification = classification;
		this.statements = statements;
		this.labelSlot = labelSlot;
		this.reference = reference;
	}

	public static Change declaration(GoAssignmentStatement assignment, List<GoStatement> statements,
	                                 GoLabeledStatement innermostLabel, GoLabeledStatement outermostLabel) {
		return new Change(assignment, null, statements, innermostLabel,
				outermostLabel != null ? outermostLabel : assignment);
	}

	public static Change mixed(GoAssignmentStatement assignment, Classification classification,
	                           List<GoStatement> statements, GoLabeledStatement innermostLabel,
	                           GoLabeledStatement outermostLabel) {
		return new Change(assignment, classification, statements, innermostLabel,
				outermostLabel != null ? outermostLabel : assignment);
	}

	public GoAssignmentStatement getAssignment() {
		return assignment;
	}

	public boolean isMixed() {
		return classification != null;
	}

	public void apply(TemporaryNameCounter counter) {
		if (isMixed()) {
			applyMixed(counter);
		} else {
			applyDeclaration();
		}
	}

	private static GoDeclarationStatement makeDeclaration(SourceLocation location, List<GoVariableName> names,
	                                                      List<GoExpression> values) {
		GoValueSpec spec = new GoValueSpec(location, names, null, values);
		return new GoDeclarationStatement(location, new GoVariableDeclaration(
				location, false, false, new ArrayList<>(Collections.singletonList(spec))));
	}

	// x, :y = ... becomes var x, y = ...
	private void applyDeclaration() {
		List<GoVariableName> names = new ArrayList<>();
		for (GoExpression target : assignment.getLhs()) {
			names.add((GoVariableName) target);
		}
		GoDeclarationStatement declaration = makeDeclaration(assignment.getLocation(), names, assignment.getRhs());
		if (labelSlot != null) {
			labelSlot.setStatement(declaration);
		} else {
			statements.set(GoASTUtils.indexOfStatement(statements, assignment), declaration);
		}
	}

	// :x, y = f() becomes tmp0, tmp1 := f(); var x = tmp0; y = tmp1
	private void applyMixed(TemporaryNameCounter counter) {
		assignment.setOperator(GoAssignmentStatement.Operator.DEFINE);
		List<GoExpression> targets = assignment.getLhs();
		List<GoStatement> followUps = new ArrayList<>();
		for (int i = 0; i < targets.size(); ++i) {
			DeclarationKind kind = classification.getKind(i);
			if (kind == DeclarationKind.IGNORED) {
				continue;
			}
			String temporary = counter.nextName();
			GoExpression target = targets.get(i);
			targets.set(i, new GoVariableName(SourceLocation.unknown(), temporary));
			List<GoExpression> value = new ArrayList<>(Collections.singletonList(
					new GoVariableName(SourceLocation.unknown(), temporary)));
			if (kind == DeclarationKind.DECLARE) {
				followUps.add(makeDeclaration(
						SourceLocation.unknown(),
						new ArrayList<>(Collections.singletonList((GoVariableName) target)),
						value));
			} else {
				followUps.add(new GoAssignmentStatement(
						SourceLocation.unknown(),
						new ArrayList<>(Collections.singletonList(target)),
						GoAssignmentStatement.Operator.ASSIGN,
						value));
			}
		}
		statements.addAll(GoASTUtils.indexOfStatement(statements, reference) + 1, followUps);
	}

	@Override
	public String toString() {
		return "Change [assignment=" + assignment + ", mixed=" + isMixed() + "]";
	}
}
