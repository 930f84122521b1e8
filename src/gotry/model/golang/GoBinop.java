package gotry.model.golang;

import java.util.Objects;

public class GoBinop extends GoExpression {

	public enum Operation {
		OR("||", 1),
		AND("&&", 2),
		EQ("==", 3),
		NEQ("!=", 3),
		LT("<", 3),
		LEQ("<=", 3),
		GT(">", 3),
		GEQ(">=", 3),
		PLUS("+", 4),
		MINUS("-", 4),
		BOR("|", 4),
		BXOR("^", 4),
		TIMES("*", 5),
		DIVIDE("/", 5),
		MOD("%", 5),
		LSHIFT("<<", 5),
		RSHIFT(">>", 5),
		BAND("&", 5),
		BCLEAR("&^", 5);

		private final String symbol;
		private final int precedence;

		Operation(String symbol, int precedence) {
			this.symbol = symbol;
			this.precedence = precedence;
		}

		public String getSymbol() {
			return symbol;
		}

		public int getPrecedence() {
			return precedence;
		}

		public static Operation fromSymbol(String symbol) {
			for (Operation op : values()) {
				if (op.symbol.equals(symbol)) {
					return op;
				}
			}
			return null;
		}
	}

	private final Operation operation;
	private final GoExpression lhs;
	private final GoExpression rhs;

	public GoBinop(Operation operation, GoExpression lhs, GoExpression rhs) {
		this.operation = operation;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public Operation getOperation() {
		return operation;
	}

	public GoExpression getLHS() {
		return lhs;
	}

	public GoExpression getRHS() {
		return rhs;
	}

	@Override
	public <T, E extends Throwable> T accept(GoExpressionVisitor<T, E> visitor) throws E {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoBinop binop = (GoBinop) o;
		return operation == binop.operation &&
				Objects.equals(lhs, binop.lhs) &&
				Objects.equals(rhs, binop.rhs);
	}

	@Override
	public int hashCode() {
		return Objects.hash(operation, lhs, rhs);
	}
}
