package colongo.model.golang;

import colongo.model.golang.type.GoFunctionParameter;
import colongo.model.golang.type.GoFunctionType;
import colongo.util.SourceLocation;

import java.util.Objects;

public class GoFunctionDeclaration extends GoDeclaration {

	// null for plain functions
	private final GoFunctionParameter receiver;
	private final String name;
	private final GoFunctionType signature;
	// null for functions implemented outside Go
	private final GoBlock body;

	public GoFunctionDeclaration(SourceLocation location, GoFunctionParameter receiver, String name,
	                             GoFunctionType signature, GoBlock body) {
		super(location);
		this.receiver = receiver;
		this.name = name;
		this.signature = signature;
		this.body = body;
	}

	public GoFunctionParameter getReceiver() {
		return receiver;
	}

	public String getName() {
		return name;
	}

	public GoFunctionType getSignature() {
		return signature;
	}

	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFunctionDeclaration that = (GoFunctionDeclaration) o;
		return Objects.equals(receiver, that.receiver) &&
				Objects.equals(name, that.name) &&
				Objects.equals(signature, that.signature) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(receiver, name, signature, body);
	}
}
