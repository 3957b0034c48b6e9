package colongo.trans.passes.desugar;

import colongo.errors.IssueContext;
import colongo.model.golang.GoNode;
import colongo.model.golang.GoWalker;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Rewrites the colon-prefixed declarations of a reverted tree into plain Go. Nothing is
 * rewritten if any issue is found.
 */
public class DesugaringPass {
	private DesugaringPass() {}

	private static final Logger logger = Logger.getLogger(DesugaringPass.class.getName());

	public static void perform(IssueContext ctx, GoNode root, String temporaryTag) {
		List<Change> changes = new ArrayList<>();
		GoWalker.walk(new DesugaringInspector(ctx, changes), root);
		if (ctx.hasErrors()) {
			return;
		}
		TemporaryNameCounter counter = new TemporaryNameCounter(temporaryTag);
		for (Change change : changes) {
			change.apply(counter);
		}
		logger.fine("applied " + changes.size() + " change(s) using " + counter.getCount() + " temporaries");
	}

}
