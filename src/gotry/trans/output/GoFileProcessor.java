package gotry.trans.output;

import gotry.errors.IssueContext;
import gotry.model.golang.GoModule;
import gotry.parser.GoParseException;
import gotry.parser.GoParser;
import gotry.stats.Stats;
import gotry.trans.passes.parse.ParsingIssue;
import gotry.trans.passes.trycheck.TryCandidateOptions;
import gotry.trans.passes.trycheck.TryCandidatePass;
import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.logging.Logger;

/**
 * Reads, analyzes and, when rewriting, updates one Go file at a time.
 */
public class GoFileProcessor {

	private final TryCandidateOptions options;
	private final Stats stats;
	private final Logger logger;
	private int fileCount = 0;

	public GoFileProcessor(TryCandidateOptions options, Stats stats, Logger logger) {
		this.options = options;
		this.stats = stats;
		this.logger = logger;
	}

	/**
	 * @return the number of files processed so far, including ones that failed
	 */
	public int getFileCount() {
		return fileCount;
	}

	/**
	 * Processes file, reporting any failure to ctx.
	 *
	 * @return whether file was rewritten
	 */
	public boolean process(IssueContext ctx, Path file) {
		++fileCount;
		logger.fine("Processing " + file);
		byte[] original;
		try {
			original = FileUtils.readFileToByteArray(file.toFile());
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(file, e));
			return false;
		}
		String contents = new String(original, StandardCharsets.UTF_8);

		GoModule module;
		try {
			module = GoParser.parse(file, contents);
		} catch (GoParseException e) {
			ctx.error(new ParsingIssue(e, contents));
			return false;
		}

		boolean modified = TryCandidatePass.perform(module, options, stats);
		if (!modified || !options.isRewrite()) {
			return false;
		}

		String rewritten = GoSourceSplicer.splice(contents, module);
		try {
			writeWithBackup(file, original, rewritten);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(file, e));
			return false;
		}
		logger.fine("Rewrote " + file);
		return true;
	}

	/**
	 * Keeps a copy of the original contents next to file while it is overwritten, restoring it if the write fails.
	 */
	static void writeWithBackup(Path file, byte[] original, String contents) throws IOException {
		Path directory = file.toAbsolutePath().getParent();
		Path backup = Files.createTempFile(directory, file.getFileName().toString() + ".", "");
		try {
			if (Files.getFileAttributeView(file, PosixFileAttributeView.class) != null) {
				Files.setPosixFilePermissions(backup, Files.getPosixFilePermissions(file));
			}
			FileUtils.writeByteArrayToFile(backup.toFile(), original);
		} catch (IOException e) {
			Files.deleteIfExists(backup);
			throw e;
		}

		try {
			FileUtils.writeStringToFile(file.toFile(), contents, StandardCharsets.UTF_8);
		} catch (IOException e) {
			Files.move(backup, file, StandardCopyOption.REPLACE_EXISTING);
			throw e;
		}
		Files.delete(backup);
	}
}
