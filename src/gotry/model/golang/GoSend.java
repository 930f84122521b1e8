package gotry.model.golang;

import java.util.Objects;

/**
 * ch <- value
 */
public class GoSend extends GoStatement {

	private final GoExpression channel;
	private final GoExpression value;

	public GoSend(GoExpression channel, GoExpression value) {
		this.channel = channel;
		this.value = value;
	}

	public GoExpression getChannel() {
		return channel;
	}

	public GoExpression getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(GoStatementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoSend goSend = (GoSend) o;
		return Objects.equals(channel, goSend.channel) &&
				Objects.equals(value, goSend.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(channel, value);
	}
}
