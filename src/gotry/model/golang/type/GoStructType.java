package gotry.model.golang.type;

import gotry.model.golang.GoField;

import java.util.List;
import java.util.Objects;

public class GoStructType extends GoType {

	private final List<GoField> fields;
	private final boolean incomplete;

	public GoStructType(List<GoField> fields) {
		this(fields, false);
	}

	/**
	 * @param incomplete true when some fields were elided from the list
	 */
	public GoStructType(List<GoField> fields, boolean incomplete) {
		this.fields = fields;
		this.incomplete = incomplete;
	}

	public List<GoField> getFields() {
		return fields;
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
		GoStructType that = (GoStructType) o;
		return incomplete == that.incomplete &&
				Objects.equals(fields, that.fields);
	}

	@Override
	public int hashCode() {
		return Objects.hash(fields, incomplete);
	}

}
