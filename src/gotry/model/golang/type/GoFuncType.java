package gotry.model.golang.type;

import gotry.model.golang.GoField;

import java.util.List;
import java.util.Objects;

/**
 * A function signature: func(params) results. Also used for the signature of function literals and
 * interface methods.
 */
public class GoFuncType extends GoType {

	private final List<GoField> typeParameters;
	private final List<GoField> parameters;
	private final List<GoField> results;

	public GoFuncType(List<GoField> typeParameters, List<GoField> parameters, List<GoField> results) {
		this.typeParameters = typeParameters;
		this.parameters = parameters;
		this.results = results;
	}

	public List<GoField> getTypeParameters() {
		return typeParameters;
	}

	public List<GoField> getParameters() {
		return parameters;
	}

	public List<GoField> getResults() {
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
		GoFuncType funcType = (GoFuncType) o;
		return Objects.equals(typeParameters, funcType.typeParameters) &&
				Objects.equals(parameters, funcType.parameters) &&
				Objects.equals(results, funcType.results);
	}

	@Override
	public int hashCode() {
		return Objects.hash(typeParameters, parameters, results);
	}

}
