package gotry;

/**
 * Thrown when an internal invariant is violated, e.g. rewriting an error check that was never accepted as a
 * try candidate. Never caught inside the tool.
 */
public class InternalToolError extends RuntimeException {
	public InternalToolError() {
		super("internal tool error");
	}

	public InternalToolError(String message) {
		super("internal tool error: " + message);
	}

	public InternalToolError(Exception e) {
		super("internal tool error", e);
	}
}
