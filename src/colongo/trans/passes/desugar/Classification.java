package colongo.trans.passes.desugar;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class Classification {

	private final List<DeclarationKind> kinds;
	private final int declareCount;
	private final int reassignCount;

	public Classification(List<DeclarationKind> kinds) {
		this.kinds = Collections.unmodifiableList(kinds);
		int declare = 0;
		int reassign = 0;
		for (DeclarationKind kind : kinds) {
			if (kind == DeclarationKind.DECLARE) {
				declare++;
			} else if (kind == DeclarationKind.REASSIGN) {
				reassign++;
			}
		}
		this.declareCount = declare;
		this.reassignCount = reassign;
	}

	/**
	 * @return one entry per target, in source order
	 */
	public List<DeclarationKind> getKinds() {
		return kinds;
	}

	public DeclarationKind getKind(int index) {
		return kinds.get(index);
	}

	public int getDeclareCount() {
		return declareCount;
	}

	public int getReassignCount() {
		return reassignCount;
	}

	public boolean declaresAnything() {
		return declareCount > 0;
	}

	/**
	 * @return whether some targets are declared while others are reassigned
	 */
	public boolean isMixed() {
		return declareCount > 0 && reassignCount > 0;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Classification that = (Classification) o;
		return Objects.equals(kinds, that.kinds);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kinds);
	}

	@Override
	public String toString() {
		return "Classification" + kinds;
	}
}
