package colongo.trans.passes.desugar;

import colongo.errors.IssueContext;
import colongo.model.golang.*;
import colongo.model.golang.type.GoTypeName;

import java.util.Arrays;
import java.util.List;

/**
 * Finds the assignments that declare names. Assignments in a header or a select case, and
 * range clauses, are settled in place; the others are recorded as {@link Change}s.
 *
 * Each inspector describes the position of the node it is given, and hands a fresh one to the
 * node's children.
 */
public class DesugaringInspector extends GoInspector {

	private final IssueContext ctx;
	private final List<Change> changes;

	// the statement list holding the inspected node, if it is a statement
	private List<GoStatement> statements;
	// whether the node is in the header of an if, for or switch
	private boolean init;
	// the communication of the select case the node belongs to
	private GoStatement communication;
	private GoLabeledStatement innermostLabel;
	private GoLabeledStatement outermostLabel;

	public DesugaringInspector(IssueContext ctx, List<Change> changes) {
		this.ctx = ctx;
		this.changes = changes;
	}

	@Override
	public GoInspector inspect(GoNode node) {
		DesugaringInspector child = new DesugaringInspector(ctx, changes);
		if (node instanceof GoAssignmentStatement) {
			inspectAssignment((GoAssignmentStatement) node);
		} else if (node instanceof GoBlock) {
			child.statements = ((GoBlock) node).getStatements();
		} else if (node instanceof GoSwitchCase) {
			child.statements = ((GoSwitchCase) node).getBody();
		} else if (node instanceof GoSelectCase) {
			child.statements = ((GoSelectCase) node).getBody();
			child.communication = ((GoSelectCase) node).getCommunication();
		} else if (node instanceof GoLabeledStatement) {
			// labels may be nested
			child.statements = statements;
			child.innermostLabel = (GoLabeledStatement) node;
			child.outermostLabel = outermostLabel != null ? outermostLabel : (GoLabeledStatement) node;
		} else if (node instanceof GoForRange) {
			inspectRange((GoForRange) node);
		} else if (node instanceof GoFor || node instanceof GoIf || node instanceof GoSwitch ||
				node instanceof GoTypeSwitch) {
			child.init = true;
		} else if (node instanceof GoVariableName) {
			checkLeftoverMarker(node, ((GoVariableName) node).getName());
		} else if (node instanceof GoTypeName) {
			String name = ((GoTypeName) node).getName();
			checkLeftoverMarker(node, name.substring(name.indexOf('.') + 1));
		} else if (node instanceof GoSelectorExpression) {
			checkLeftoverMarker(node, ((GoSelectorExpression) node).getName());
		}
		return child;
	}

	private void inspectAssignment(GoAssignmentStatement assignment) {
		Classification classification = DeclarationClassifier.classify(assignment.getLhs());
		if (!classification.declaresAnything()) {
			return;
		}
		if (init || communication == assignment) {
			if (classification.isMixed()) {
				ctx.error(new MixedAssignmentIssue(
						assignment.getLocation(), MixedAssignmentIssue.Position.INIT_STATEMENT));
			} else {
				assignment.setOperator(GoAssignmentStatement.Operator.DEFINE);
			}
			return;
		}
		if (classification.isMixed()) {
			changes.add(Change.mixed(assignment, classification, statements, innermostLabel, outermostLabel));
		} else {
			changes.add(Change.declaration(assignment, statements, innermostLabel, outermostLabel));
		}
	}

	private void inspectRange(GoForRange forRange) {
		Classification classification = DeclarationClassifier.classify(
				Arrays.asList(forRange.getKey(), forRange.getValue()));
		if (!classification.declaresAnything()) {
			return;
		}
		if (classification.isMixed()) {
			ctx.error(new MixedAssignmentIssue(forRange.getLocation(), MixedAssignmentIssue.Position.RANGE));
		} else {
			forRange.setOperator(GoAssignmentStatement.Operator.DEFINE);
		}
	}

	// valid markers were already stripped by the classifier when their assignment was inspected
	private void checkLeftoverMarker(GoNode node, String name) {
		if (name.startsWith(":")) {
			ctx.error(new UnexpectedMarkerIssue(node.getLocation(), name));
		}
	}

}
