package colongo.model.golang;

/**
 * Called by {@link GoWalker} on every node of a tree, parents before children.
 */
public abstract class GoInspector {

	/**
	 * @return the inspector to use for the node's children, or null to skip them
	 */
	public abstract GoInspector inspect(GoNode node);

}
