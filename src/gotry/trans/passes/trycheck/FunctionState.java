package gotry.trans.passes.trycheck;

public class FunctionState {

	private boolean modified = false;
	private final SharedReturnTracker sharedReturns = new SharedReturnTracker();

	public boolean isModified() {
		return modified;
	}

	public void markModified() {
		modified = true;
	}

	public SharedReturnTracker getSharedReturns() {
		return sharedReturns;
	}
}
