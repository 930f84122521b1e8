package gotry.model.golang;

import java.util.List;
import java.util.Objects;

/**
 * A case clause of an expression or type switch. An empty condition list is the default clause; in a type
 * switch the conditions are types.
 */
public class GoSwitchCase extends GoNode {
	private final List<GoExpression> conditions;
	private final List<GoStatement> block;
	
	public GoSwitchCase(List<GoExpression> conditions, List<GoStatement> block) {
		this.conditions = conditions;
		this.block = block;
	}

	public List<GoExpression> getConditions() {
		return conditions;
	}

	public List<GoStatement> getBlock() {
		return block;
	}

	public boolean isDefault() {
		return conditions.isEmpty();
	}
	
	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSwitchCase that = (GoSwitchCase) o;
		return Objects.equals(conditions, that.conditions) &&
				Objects.equals(block, that.block);
	}

	@Override
	public int hashCode() {

		return Objects.hash(conditions, block);
	}
}
