package gotry;

import gotry.errors.TopLevelIssueContext;
import gotry.stats.Stats;
import gotry.stats.StatsReporter;
import gotry.trans.output.GoFileCollector;
import gotry.trans.output.GoFileProcessor;
import gotry.trans.output.IOErrorIssue;
import gotry.trans.passes.parse.option.OptionParsingPass;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class GoTryMain {
	static final int EXIT_ERROR = 2;

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;
	private static final Logger logger = Logger.getLogger("GoTryMain");

	public GoTryMain(String[] args, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		// FINE records only reach the console if the handler lets them through
		ConsoleHandler handler = new ConsoleHandler();
		handler.setLevel(Level.ALL);
		logger.setUseParentHandlers(false);
		logger.addHandler(handler);
		System.exit(new GoTryMain(args, System.out, System.err).run());
	}

	/**
	 * @return the process exit code
	 */
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		GoTryOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			opts.printHelp();
			return EXIT_ERROR;
		}
		if (opts.version) {
			out.println("gotry version " + GoTryOptions.VERSION);
			return 0;
		}
		if (opts.help) {
			opts.printHelp();
			return 0;
		}

		Stats stats = new Stats();
		GoFileCollector collector = new GoFileCollector(opts.ignorePattern);
		GoFileProcessor processor = new GoFileProcessor(opts.toTryCandidateOptions(), stats, logger);
		int rewritten = 0;
		for (String arg : opts.paths) {
			Path path = Paths.get(arg);
			if (Files.isDirectory(path)) {
				logger.info("Scanning " + path);
				for (Path file : collector.collect(path)) {
					if (processor.process(ctx, file)) {
						++rewritten;
					}
				}
			} else if (Files.exists(path)) {
				if (processor.process(ctx, path)) {
					++rewritten;
				}
			} else {
				ctx.error(new IOErrorIssue(path, new NoSuchFileException(arg)));
			}
		}
		logger.info("Processed " + processor.getFileCount() + " file(s), rewrote " + rewritten);

		if (processor.getFileCount() > 0) {
			StatsReporter reporter = new StatsReporter(stats, opts.list);
			if (opts.list) {
				reporter.reportPositions(out);
			}
			reporter.reportCounts(out);
		}

		if (ctx.hasErrors()) {
			err.println(ctx.format());
			logger.info("Terminated with errors");
			return EXIT_ERROR;
		}
		logger.info("Finished");
		return 0;
	}
}
