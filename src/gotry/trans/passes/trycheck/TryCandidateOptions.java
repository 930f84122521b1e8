package gotry.trans.passes.trycheck;

public class TryCandidateOptions {

	public static final String DEFAULT_ERROR_VARIABLE_NAME = "err";
	public static final String DEFAULT_ERROR_TYPE_NAME = "error";

	private final String errorVariableName;
	private final String errorTypeName;
	private final boolean rewrite;

	/**
	 * @param errorVariableName the name error checks must test, or "" to accept any name
	 * @param errorTypeName the result type marking a function as returning an error
	 * @param rewrite whether try candidates are collapsed in the tree
	 */
	public TryCandidateOptions(String errorVariableName, String errorTypeName, boolean rewrite) {
		this.errorVariableName = errorVariableName;
		this.errorTypeName = errorTypeName;
		this.rewrite = rewrite;
	}

	public TryCandidateOptions(boolean rewrite) {
		this(DEFAULT_ERROR_VARIABLE_NAME, DEFAULT_ERROR_TYPE_NAME, rewrite);
	}

	public String getErrorVariableName() {
		return errorVariableName;
	}

	public boolean acceptsAnyErrorVariableName() {
		return errorVariableName.isEmpty();
	}

	public String getErrorTypeName() {
		return errorTypeName;
	}

	public boolean isRewrite() {
		return rewrite;
	}
}
