package gotry;

import gotry.trans.passes.trycheck.TryCandidateOptions;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class GoTryOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-l List positions of try candidates and rejected error checks", aliases = {"-list"})
	public boolean list = false;

	@Option(value = "-r Rewrite try candidates in place", aliases = {"-rewrite"})
	public boolean rewrite = false;

	@Option(value = "Name of the error variable; \"\" permits any name", aliases = {"-err"})
	public String errorVariableName = TryCandidateOptions.DEFAULT_ERROR_VARIABLE_NAME;

	@Option(value = "Name of the error result type", aliases = {"-type"})
	public String errorTypeName = TryCandidateOptions.DEFAULT_ERROR_TYPE_NAME;

	@Option(value = "Ignore files with paths matching this regular expression", aliases = {"-ignore"})
	public String ignore = "vendor";

	@Option("-c path to the configuration file, if any")
	public String configFilePath;

	public List<String> paths;
	public Pattern ignorePattern;

	private final Options plumeOptions;
	private final String[] args;

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public GoTryOptions(String[] args) {
		this.plumeOptions = new Options("gotry [options] path...", this);
		this.args = args;
	}

	/**
	 * Reads the command line and, if given, the configuration file, whose keys take precedence over flags.
	 */
	public void parse() throws GoTryOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new GoTryOptionException(e.getMessage());
		}
		paths = Arrays.asList(remainingArgs);

		if (configFilePath != null && !configFilePath.isEmpty()) {
			readConfig();
		}

		if (!ignore.isEmpty()) {
			try {
				ignorePattern = Pattern.compile(ignore);
			} catch (PatternSyntaxException e) {
				throw new GoTryOptionException("invalid ignore pattern: " + e.getMessage());
			}
		}
	}

	private void readConfig() throws GoTryOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new GoTryOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
			errorVariableName = config.optString("err", errorVariableName);
			errorTypeName = config.optString("type", errorTypeName);
			ignore = config.optString("ignore", ignore);
			if (config.has("list")) {
				list = config.getBoolean("list");
			}
			if (config.has("rewrite")) {
				rewrite = config.getBoolean("rewrite");
			}
		} catch (JSONException e) {
			throw new GoTryOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
	}

	public TryCandidateOptions toTryCandidateOptions() {
		return new TryCandidateOptions(errorVariableName, errorTypeName, rewrite);
	}
}
