package colongo.trans.passes.desugar;

/**
 * Hands out the names of temporaries for one translation run: tag0, tag1, ...
 */
public class TemporaryNameCounter {

	private final String tag;
	private int next = 0;

	public TemporaryNameCounter(String tag) {
		this.tag = tag;
	}

	public String nextName() {
		return tag + next++;
	}

	public int getCount() {
		return next;
	}

}
