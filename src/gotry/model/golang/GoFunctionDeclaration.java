package gotry.model.golang;

import gotry.model.golang.type.GoFuncType;

import java.util.List;
import java.util.Objects;

/**
 * Represents a top-level function or method in go
 *
 */
public class GoFunctionDeclaration extends GoDeclaration {
	private final String name;
	
	private final GoField receiver;
	private final GoFuncType type;
	private final GoBlock body;
	
	public GoFunctionDeclaration(String name, GoField receiver, GoFuncType type, GoBlock body) {
		this.name = name;
		this.receiver = receiver;
		this.type = type;
		this.body = body;
	}
	
	public String getName() {
		return name;
	}

	/**
	 * @return the receiver of a method, or null for a plain function
	 */
	public GoField getReceiver() {
		return receiver;
	}

	public GoFuncType getType() {
		return type;
	}
	
	public List<GoField> getResults(){
		return type.getResults();
	}

	/**
	 * @return the body, or null for a function implemented outside Go
	 */
	public GoBlock getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(GoDeclarationVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		GoFunctionDeclaration that = (GoFunctionDeclaration) o;
		return Objects.equals(name, that.name) &&
				Objects.equals(receiver, that.receiver) &&
				Objects.equals(type, that.type) &&
				Objects.equals(body, that.body);
	}

	@Override
	public int hashCode() {

		return Objects.hash(name, receiver, type, body);
	}
}
