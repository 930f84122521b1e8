package gotry;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Runs the tool end to end on copies of the Go fixtures under test/go.
 */
public class GoTryMainTest {

	static Path fixtures = Paths.get("test", "go");

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int run(String... args) throws UnsupportedEncodingException {
		return new GoTryMain(args, new PrintStream(out, true, "UTF-8"), new PrintStream(err, true, "UTF-8")).run();
	}

	private String out() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(err.toByteArray(), StandardCharsets.UTF_8);
	}

	private File copyFixture(String name, String directory) throws IOException {
		File target = new File(folder.getRoot(), directory + File.separator + name);
		FileUtils.copyFile(fixtures.resolve(name).toFile(), target);
		return target;
	}

	private static String read(File file) throws IOException {
		return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
	}

	@Test
	public void rewritesInPlace() throws IOException {
		File file = copyFixture("sample.go", "src");
		assertThat(run("-q", "-r", folder.getRoot().getPath()), is(0));
		assertThat(read(file), is(read(fixtures.resolve("sample.go.golden").toFile())));
		assertThat(file.getParentFile().list().length, is(1));
		assertThat(err(), is(""));
	}

	@Test
	public void rewritingTwiceChangesNothing() throws IOException {
		File file = copyFixture("sample.go", "src");
		assertThat(run("-q", "-r", file.getPath()), is(0));
		String once = read(file);
		assertThat(run("-q", "-r", file.getPath()), is(0));
		assertThat(read(file), is(once));
	}

	@Test
	public void countsWithoutRewriting() throws IOException {
		File file = copyFixture("sample.go", "src");
		String before = read(file);
		assertThat(run("-q", file.getPath()), is(0));
		assertThat(read(file), is(before));

		String report = out();
		assertThat(report, startsWith("--- stats ---"));
		assertThat(report, containsString("      4 (100.0% of       4) function declarations"));
		assertThat(report, containsString("     31 (100.0% of      31) statements"));
		assertThat(report, containsString("      8 ( 25.8% of      31) if statements"));
		assertThat(report, containsString("      7 ( 87.5% of       8) if <err> != nil statements"));
		assertThat(report, containsString("      2 ( 28.6% of       7) try candidates (use -l flag to list file positions)"));
		assertThat(report, containsString("      2 ( 28.6% of       7) return blocks with non-zero leading results"));
		assertThat(report, containsString("      2 ( 28.6% of       7) shared return expressions in error handlers"));
	}

	@Test
	public void listsPositionsBeforeCounts() throws IOException {
		File file = copyFixture("sample.go", "src");
		assertThat(run("-q", "-l", file.getPath()), is(0));

		String report = out();
		String nl = System.lineSeparator();
		assertTrue(report.contains("--- try candidates ---"));
		assertTrue(report.indexOf("--- try candidates ---") < report.indexOf("--- stats ---"));
		assertThat(report, containsString("      1  " + file.getPath() + ":18" + nl));
		assertThat(report, containsString("      2  " + file.getPath() + ":23" + nl));
		// return false, err keeps its check
		String nonZero = report.substring(report.indexOf("--- return blocks with non-zero leading results ---"));
		assertThat(nonZero, containsString(file.getPath() + ":67" + nl));
		assertThat(report.indexOf(":67" + nl), is(report.lastIndexOf(":67" + nl)));
		assertThat(report, containsString(file.getPath() + ":33" + nl));
		assertThat(report, containsString(file.getPath() + ":37" + nl));
		assertThat(report, not(containsString("use -l flag")));
	}

	@Test
	public void ignoredDirectoriesAreSkipped() throws IOException {
		copyFixture("sample.go", "vendor");
		assertThat(run("-q", folder.getRoot().getPath()), is(0));
		assertThat(out(), is(""));

		assertThat(run("-q", "-ignore", "", folder.getRoot().getPath()), is(0));
		assertThat(out(), startsWith("--- stats ---"));
	}

	@Test
	public void missingPathIsAnError() throws IOException {
		File file = copyFixture("sample.go", "src");
		String missing = new File(folder.getRoot(), "missing.go").getPath();
		assertThat(run("-q", missing, file.getPath()), is(GoTryMain.EXIT_ERROR));
		assertThat(err(), containsString("missing.go"));
		assertThat(out(), startsWith("--- stats ---"));
	}

	@Test
	public void parseErrorsStillReportTheOtherFiles() throws IOException {
		copyFixture("sample.go", "src");
		FileUtils.writeStringToFile(new File(folder.getRoot(), "src" + File.separator + "broken.go"),
				"package p\n\nfunc (\n", StandardCharsets.UTF_8);
		assertThat(run("-q", folder.getRoot().getPath()), is(GoTryMain.EXIT_ERROR));
		assertThat(err(), containsString("broken.go"));
		assertThat(out(), containsString("      4 (100.0% of       4) function declarations"));
	}

	@Test
	public void badFlag() throws IOException {
		assertThat(run("-ignore", "(", "x"), is(GoTryMain.EXIT_ERROR));
		assertThat(err(), containsString("ignore"));
	}

	@Test
	public void version() throws IOException {
		assertThat(run("-version"), is(0));
		assertThat(out(), containsString(GoTryOptions.VERSION));
	}

	@Test
	public void noPathsNoReport() throws IOException {
		assertThat(run("-q"), is(0));
		assertThat(out(), is(""));
	}

}
