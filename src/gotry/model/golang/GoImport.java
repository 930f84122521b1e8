package gotry.model.golang;

import java.util.Objects;

public class GoImport extends GoNode {

	private final String name;
	private final GoStringLiteral path;

	public GoImport(String name, GoStringLiteral path) {
		this.name = name;
		this.path = path;
	}

	/**
	 * @return the local name, "." or "_", or null when the package name is used
	 */
	public String getName() {
		return name;
	}

	public GoStringLiteral getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoImport goImport = (GoImport) o;
		return Objects.equals(name, goImport.name) &&
				Objects.equals(path, goImport.path);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, path);
	}
}
