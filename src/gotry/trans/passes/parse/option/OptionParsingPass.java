package gotry.trans.passes.parse.option;

import gotry.GoTryOptionException;
import gotry.GoTryOptions;
import gotry.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	static Level logLevel(GoTryOptions opts) {
		if (opts.logLvlQuiet) {
			return Level.WARNING;
		}
		if (opts.logLvlVerbose) {
			return Level.FINE;
		}
		return Level.INFO;
	}

	/**
	 * Parses args, reporting malformed flags or configuration to ctx, and sets logger's level from -q and -v.
	 * The returned options are only meaningful if ctx has no errors.
	 */
	public static GoTryOptions perform(IssueContext ctx, Logger logger, String[] args) {
		GoTryOptions opts = new GoTryOptions(args);
		try {
			opts.parse();
		} catch (GoTryOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		logger.setLevel(logLevel(opts));
		logger.fine("Mode: " + (opts.rewrite ? "rewrite" : opts.list ? "list" : "count") +
				", error variable: " + (opts.errorVariableName.isEmpty() ? "<any>" : opts.errorVariableName) +
				", error type: " + opts.errorTypeName);
		return opts;
	}
}
