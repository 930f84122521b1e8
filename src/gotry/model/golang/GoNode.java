package gotry.model.golang;

import gotry.Unreachable;
import gotry.formatters.GoNodeFormattingVisitor;
import gotry.formatters.IndentingWriter;
import gotry.util.SourceLocatable;
import gotry.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;

/**
 * Base class of the Go AST. Locations are metadata: they take no part in equals or hashCode.
 */
public abstract class GoNode extends SourceLocatable {

	private SourceLocation location = SourceLocation.unknown();

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public void setLocation(SourceLocation location) {
		this.location = location;
	}

	public abstract <T, E extends Throwable> T accept(GoNodeVisitor<T, E> v) throws E;

	@Override
	public abstract boolean equals(Object other);

	@Override
	public abstract int hashCode();

	@Override
	public String toString() {
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		try {
			accept(new GoNodeFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable("formatting a node into a string", e);
		}
		return w.toString();
	}

}
