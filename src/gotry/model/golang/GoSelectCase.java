package gotry.model.golang;

import java.util.List;
import java.util.Objects;

public class GoSelectCase extends GoNode {
	private final GoStatement comm;
	private final List<GoStatement> block;

	public GoSelectCase(GoStatement comm, List<GoStatement> block) {
		this.comm = comm;
		this.block = block;
	}

	/**
	 * @return the send or receive statement of this case, or null for the default case
	 */
	public GoStatement getComm() {
		return comm;
	}

	public List<GoStatement> getBlock() {
		return block;
	}

	public boolean isDefault() {
		return comm == null;
	}

	@Override
	public <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSelectCase that = (GoSelectCase) o;
		return Objects.equals(comm, that.comm) &&
				Objects.equals(block, that.block);
	}

	@Override
	public int hashCode() {

		return Objects.hash(comm, block);
	}
}
