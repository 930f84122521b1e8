package gotry.parser;

import gotry.GoTryException;
import gotry.util.SourceLocation;

/**
 * Thrown when a Go source file cannot be tokenized or parsed
 */
public class GoParseException extends GoTryException {

	private final SourceLocation location;

	public GoParseException(String msg, SourceLocation location) {
		this("Go parse error", msg, location);
	}

	protected GoParseException(String prefix, String msg, SourceLocation location) {
		super(prefix, msg, location.getStartLine());
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

}
