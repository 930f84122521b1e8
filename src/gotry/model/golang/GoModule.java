package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * A single Go source file
 */
public class GoModule extends GoNode {

	private final String packageName;
	private final List<GoImport> imports;
	private final List<GoDeclaration> declarations;

	public GoModule(String packageName, List<GoImport> imports, List<GoDeclaration> declarations) {
		this.packageName = packageName;
		this.imports = imports;
		this.declarations = declarations;
	}

	public String getPackageName() {
		return packageName;
	}

	public List<GoImport> getImports() {
		return imports;
	}

	public List<GoDeclaration> getDeclarations() {
		return declarations;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoModule goModule = (GoModule) o;
		return Objects.equals(packageName, goModule.packageName) &&
				Objects.equals(imports, goModule.imports) &&
				Objects.equals(declarations, goModule.declarations);
	}

	@Override
	public int hashCode() {

		return Objects.hash(packageName, imports, declarations);
	}
}
