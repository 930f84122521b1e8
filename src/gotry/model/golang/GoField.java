package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a parameter, result, receiver, type parameter, struct field or interface element list:
 * zero or more names sharing a type, with an optional struct tag.
 */
public class GoField extends GoNode {

	private final List<String> names;
	private final GoExpression type;
	private final GoStringLiteral tag;

	public GoField(List<String> names, GoExpression type) {
		this(names, type, null);
	}

	public GoField(List<String> names, GoExpression type, GoStringLiteral tag) {
		this.names = names;
		this.type = type;
		this.tag = tag;
	}

	public List<String> getNames() {
		return names;
	}

	public GoExpression getType() {
		return type;
	}

	public GoStringLiteral getTag() {
		return tag;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoField goField = (GoField) o;
		return Objects.equals(names, goField.names) &&
				Objects.equals(type, goField.type) &&
				Objects.equals(tag, goField.tag);
	}

	@Override
	public int hashCode() {
		return Objects.hash(names, type, tag);
	}
}
