package gotry;

public class GoTryOptionException extends GoTryException {

	private static final long serialVersionUID = 4150943734221497624L;

	public GoTryOptionException(String msg) {
		super("Option Error", msg);
	}

}
