package gotry.model.golang.type;

import java.util.Objects;

/**
 * A named type, optionally qualified by a package name (e.g. io.Reader)
 */
public class GoTypeName extends GoType {

	private final String qualifier;
	private final String name;

	public GoTypeName(String name) {
		this(null, name);
	}

	public GoTypeName(String qualifier, String name) {
		this.qualifier = qualifier;
		this.name = name;
	}

	/**
	 * @return the package qualifier, or null for an unqualified name
	 */
	public String getQualifier() {
		return qualifier;
	}

	public String getName() {
		return name;
	}

	public boolean isUnqualified(String expectedName) {
		return qualifier == null && name.equals(expectedName);
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoTypeName that = (GoTypeName) o;
		return Objects.equals(qualifier, that.qualifier) &&
				Objects.equals(name, that.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(qualifier, name);
	}

}
