package gotry;

/**
 * Thrown where a checked exception is declared but cannot happen, such as an IOException from a writer backed by
 * a string.
 */
public class Unreachable extends RuntimeException {
	public Unreachable(String reason) {
		super("unreachable: " + reason);
	}

	public Unreachable(String reason, Exception cause) {
		super("unreachable: " + reason, cause);
	}
}
