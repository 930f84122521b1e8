package gotry.lexer;

import gotry.util.SourceLocatable;
import gotry.util.SourceLocation;

import java.util.Objects;

public class GoToken extends SourceLocatable {

	private final String value;
	private final GoTokenType type;
	private final SourceLocation location;

	public GoToken(String value, GoTokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the token text; "\n" for a semicolon inserted at a line break, "" at the end of the file
	 */
	public String getValue() {
		return value;
	}

	public GoTokenType getType() {
		return type;
	}

	public boolean is(GoTokenType type, String value) {
		return this.type == type && this.value.equals(value);
	}

	/**
	 * @return a human readable description, for error messages
	 */
	public String describe() {
		switch (type) {
			case SEMICOLON:
				return value.equals(";") ? "';'" : "newline";
			case EOF:
				return "EOF";
			default:
				return "'" + value + "'";
		}
	}

	@Override
	public String toString() {
		return "GoToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoToken goToken = (GoToken) o;
		return Objects.equals(value, goToken.value) &&
				type == goToken.type &&
				Objects.equals(location, goToken.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(value, type, location);
	}

}
