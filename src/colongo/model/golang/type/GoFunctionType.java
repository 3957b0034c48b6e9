package colongo.model.golang.type;

import colongo.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A function signature. Results written without parentheses are a single unnamed parameter.
 */
public class GoFunctionType extends GoType {

	private final List<GoFunctionParameter> parameters;
	private final List<GoFunctionParameter> results;

	public GoFunctionType(SourceLocation location, List<GoFunctionParameter> parameters,
	                      List<GoFunctionParameter> results) {
		super(location);
		this.parameters = parameters;
		this.results = results;
	}

	public List<GoFunctionParameter> getParameters() {
		return parameters;
	}

	public List<GoFunctionParameter> getResults() {
		return results;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFunctionType that = (GoFunctionType) o;
		return Objects.equals(parameters, that.parameters) &&
				Objects.equals(results, that.results);
	}

	@Override
	public int hashCode() {
		return Objects.hash(parameters, results);
	}
}
