package gotry.model.golang.type;

import gotry.model.golang.GoField;

import java.util.List;
import java.util.Objects;

/**
 * An interface type. Methods are fields with a single name and a {@link GoFuncType}; embedded interfaces and
 * type-set elements (unions, ~T) are fields without names.
 */
public class GoInterfaceType extends GoType {

	private final List<GoField> elements;
	private final boolean incomplete;

	public GoInterfaceType(List<GoField> elements) {
		this(elements, false);
	}

	public GoInterfaceType(List<GoField> elements, boolean incomplete) {
		this.elements = elements;
		this.incomplete = incomplete;
	}

	public List<GoField> getElements() {
		return elements;
	}

	public boolean isIncomplete() {
		return incomplete;
	}

	@Override
	public <T, E extends Throwable> T accept(GoTypeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoInterfaceType that = (GoInterfaceType) o;
		return incomplete == that.incomplete &&
				Objects.equals(elements, that.elements);
	}

	@Override
	public int hashCode() {
		return Objects.hash(elements, incomplete);
	}

}
