package colongo.model.golang;

import colongo.util.SourceLocation;

import java.util.Objects;

/**
 * target[low:high] or target[low:high:max]; any of low and high may be null.
 */
public class GoSliceOperator extends GoExpression {

	private final GoExpression target;
	private final GoExpression low;
	private final GoExpression high;
	private final GoExpression max;

	public GoSliceOperator(SourceLocation location, GoExpression target, GoExpression low, GoExpression high,
	                       GoExpression max) {
		super(location);
		this.target = target;
		this.low = low;
		this.high = high;
		this.max = max;
	}

	public GoExpression getTarget() {
		return target;
	}

	public GoExpression getLow() {
		return low;
	}

	public GoExpression getHigh() {
		return high;
	}

	public GoExpression getMax() {
		return max;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSliceOperator that = (GoSliceOperator) o;
		return Objects.equals(target, that.target) &&
				Objects.equals(low, that.low) &&
				Objects.equals(high, that.high) &&
				Objects.equals(max, that.max);
	}

	@Override
	public int hashCode() {
		return Objects.hash(target, low, high, max);
	}
}
