package gotry.stats;

/**
 * The closed set of things counted while looking for try candidates. Each kind is reported as a percentage of
 * its parent kind; kinds that record positions can be listed with -l.
 */
public enum StatKind {
	FUNC("FUNC", false, "function declarations"),
	FUNC_ERROR("FUNC", false, "functions returning an error"),
	STMT("STMT", false, "statements"),
	IF("STMT", false, "if statements"),
	IF_ERR("IF", false, "if <err> != nil statements"),
	NON_ERR_NAME("IF_ERR", true, "<err> name is different from \"err\""),
	RETURN_EXPR("IF_ERR", true, "return ..., <expr> blocks where <expr> is not <err>"),
	NON_ZERO_RESULTS("IF_ERR", true, "return blocks with non-zero leading results"),
	SINGLE_STMT_HANDLER("IF_ERR", true, "single non-return statement error handlers"),
	MULTI_STMT_HANDLER("IF_ERR", true, "multi-statement error handlers"),
	HAS_ELSE("IF_ERR", true, "non-empty else blocks"),
	TRY_CANDIDATE("IF_ERR", true, "try candidates"),
	SHARED_RETURN("IF_ERR", true, "shared return expressions in error handlers");

	// by name, since an enum constant cannot refer to a later one in its constructor
	private final String parent;
	private final boolean recordsPositions;
	private final String description;

	StatKind(String parent, boolean recordsPositions, String description) {
		this.parent = parent;
		this.recordsPositions = recordsPositions;
		this.description = description;
	}

	public StatKind getParent() {
		return valueOf(parent);
	}

	public boolean recordsPositions() {
		return recordsPositions;
	}

	public String getDescription() {
		return description;
	}
}
