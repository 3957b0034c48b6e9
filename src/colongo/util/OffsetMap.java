package colongo.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Records the characters a rewriting pass inserted into a text, so that offsets into the
 * rewritten text can be mapped back to the text it was produced from.
 *
 * Insertions must be recorded in increasing order of their position in the rewritten text.
 */
public class OffsetMap {

	private final List<Integer> positions;
	private final List<Integer> lengths;

	public OffsetMap() {
		this.positions = new ArrayList<>();
		this.lengths = new ArrayList<>();
	}

	public static OffsetMap identity() {
		return new OffsetMap();
	}

	/**
	 * @param rewrittenOffset where the inserted text starts, in rewritten coordinates
	 * @param length how many characters were inserted
	 */
	public void recordInsertion(int rewrittenOffset, int length) {
		if (length <= 0) {
			return;
		}
		if (!positions.isEmpty()) {
			int last = positions.size() - 1;
			if (rewrittenOffset < positions.get(last) + lengths.get(last)) {
				throw new IllegalArgumentException("insertions must be recorded in order");
			}
		}
		positions.add(rewrittenOffset);
		lengths.add(length);
	}

	/**
	 * Offsets that fall inside inserted text map to the point of insertion.
	 */
	public int toOriginal(int rewrittenOffset) {
		int shift = 0;
		for (int i = 0; i < positions.size(); ++i) {
			int position = positions.get(i);
			if (position >= rewrittenOffset) {
				break;
			}
			int length = lengths.get(i);
			if (rewrittenOffset < position + length) {
				return position - shift;
			}
			shift += length;
		}
		return rewrittenOffset - shift;
	}

	public boolean isIdentity() {
		return positions.isEmpty();
	}

}
