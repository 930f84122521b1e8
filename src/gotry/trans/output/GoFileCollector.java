package gotry.trans.output;

import org.apache.commons.io.FileUtils;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expands a directory into the Go files below it, in path order.
 */
public class GoFileCollector {

	private static final String[] GO_EXTENSIONS = {"go"};

	private final Pattern ignore;

	/**
	 * @param ignore files whose path contains a match are skipped; null skips nothing
	 */
	public GoFileCollector(Pattern ignore) {
		this.ignore = ignore;
	}

	public static boolean isGoFile(Path path) {
		String name = path.getFileName().toString();
		return !name.startsWith(".") && name.endsWith(".go");
	}

	public boolean isExcluded(Path path) {
		return ignore != null && ignore.matcher(path.toString()).find();
	}

	public List<Path> collect(Path directory) {
		return FileUtils.listFiles(directory.toFile(), GO_EXTENSIONS, true)
				.stream()
				.filter(File::isFile)
				.map(File::toPath)
				.filter(path -> isGoFile(path) && !isExcluded(path))
				.sorted()
				.collect(Collectors.toList());
	}
}
