package colongo.trans.passes.desugar;

/**
 * What an assignment does to one of its targets.
 */
public enum DeclarationKind {
	/** the blank identifier, or a missing range key or value */
	IGNORED,
	/** a colon-prefixed name, declared by the assignment */
	DECLARE,
	/** anything else, which must already exist */
	REASSIGN,
}
