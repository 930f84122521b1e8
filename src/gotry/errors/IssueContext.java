package gotry.errors;

/**
 * Collects the issues met while processing files. Reporting an issue never stops the run: the remaining files are
 * still processed and the issues are printed at the end.
 */
public abstract class IssueContext {

	public abstract void error(Issue issue);

	public abstract boolean hasErrors();

}
