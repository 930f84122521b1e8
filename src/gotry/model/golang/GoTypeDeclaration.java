package gotry.model.golang;

import java.util.List;
import java.util.Objects;

public class GoTypeDeclaration extends GoDeclaration {

	private final String name;
	private final List<GoField> typeParameters;
	private final boolean alias;
	private final GoExpression type;

	public GoTypeDeclaration(String name, List<GoField> typeParameters, boolean alias, GoExpression type) {
		this.name = name;
		this.typeParameters = typeParameters;
		this.alias = alias;
		this.type = type;
	}

	public String getName() {
		return name;
	}

	public List<GoField> getTypeParameters() {
		return typeParameters;
	}

	/**
	 * @return whether this is an alias declaration, type A = B
	 */
	public boolean isAlias() {
		return alias;
	}

	public GoExpression getType() {
		return type;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeDeclaration that = (GoTypeDeclaration) o;
		return alias == that.alias &&
				Objects.equals(name, that.name) &&
				Objects.equals(typeParameters, that.typeParameters) &&
				Objects.equals(type, that.type);
	}

	@Override
	public int hashCode() {

		return Objects.hash(name, typeParameters, alias, type);
	}
}
