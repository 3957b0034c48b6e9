package colongo.trans.passes.rewrite;

import colongo.util.OffsetMap;

/**
 * Marked Go source re-encoded so that an ordinary Go parser accepts it.
 */
public class RewrittenSource {

	private final String text;
	private final OffsetMap offsetMap;

	public RewrittenSource(String text, OffsetMap offsetMap) {
		this.text = text;
		this.offsetMap = offsetMap;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the insertions made while rewriting, for mapping offsets back to the input
	 */
	public OffsetMap getOffsetMap() {
		return offsetMap;
	}

}
