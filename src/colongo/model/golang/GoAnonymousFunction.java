package colongo.model.golang;

import colongo.model.golang.type.GoFunctionType;
import colongo.util.SourceLocation;

import java.util.Objects;

public class GoAnonymousFunction extends GoExpression {

	private final GoFunctionType signature;
	private final GoBlock body;

	public GoAnonymousFunction(SourceLocation location, GoFunctionType signature, GoBlock body) {
		super(location);
		this.signature = signature;
		this.body = body;
	}

	public GoFunctionType getSignature() {
		return signature;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoAnonymousFunction that = (GoAnonymousFunction) o;
		return Objects.equals(signature, that.signature) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(signature, body);
	}
}
