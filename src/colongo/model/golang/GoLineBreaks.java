package colongo.model.golang;

import java.util.ArrayList;
import java.util.List;

/**
 * Where the source broke the lines of a parenthesized or braced list, so that the printer can
 * keep a one-line list on one line and a multi-line list multi-line.
 */
public class GoLineBreaks {

	private final List<Boolean> beforeElements;
	private final boolean beforeClose;

	public GoLineBreaks(List<Boolean> beforeElements, boolean beforeClose) {
		this.beforeElements = beforeElements;
		this.beforeClose = beforeClose;
	}

	public static GoLineBreaks none() {
		return new GoLineBreaks(new ArrayList<>(), false);
	}

	/**
	 * @return whether the element at index started a new line; false for elements added after parsing
	 */
	public boolean isBreakBefore(int index) {
		return index < beforeElements.size() && beforeElements.get(index);
	}

	public boolean isBreakBeforeClose() {
		return beforeClose;
	}

	public boolean hasBreaks() {
		return beforeClose || beforeElements.contains(true);
	}

}
