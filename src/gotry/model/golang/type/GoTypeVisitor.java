package gotry.model.golang.type;

public abstract class GoTypeVisitor<T, E extends Throwable> {
	public abstract T visit(GoArrayType arrayType) throws E;
	public abstract T visit(GoChanType chanType) throws E;
	public abstract T visit(GoFuncType funcType) throws E;
	public abstract T visit(GoInterfaceType interfaceType) throws E;
	public abstract T visit(GoMapType mapType) throws E;
	public abstract T visit(GoPtrType ptrType) throws E;
	public abstract T visit(GoStructType structType) throws E;
	public abstract T visit(GoTypeName typeName) throws E;
}
