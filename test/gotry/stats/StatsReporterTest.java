package gotry.stats;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class StatsReporterTest {

	private static List<String> counts(Stats stats, boolean listMode) throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		new StatsReporter(stats, listMode).reportCounts(new PrintStream(bytes, true, "UTF-8"));
		return Arrays.asList(new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R"));
	}

	private static List<String> positions(Stats stats) throws UnsupportedEncodingException {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		new StatsReporter(stats, true).reportPositions(new PrintStream(bytes, true, "UTF-8"));
		return Arrays.asList(new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\\R", -1));
	}

	private static Stats sample() {
		Stats stats = new Stats();
		for (int i = 0; i < 4; ++i) {
			stats.count(StatKind.FUNC, StatsTest.line("a.go", i + 1));
		}
		stats.count(StatKind.FUNC_ERROR, StatsTest.line("a.go", 1));
		stats.count(StatKind.TRY_CANDIDATE, StatsTest.line("a.go", 12));
		stats.count(StatKind.TRY_CANDIDATE, StatsTest.line("b.go", 3));
		return stats;
	}

	@Test
	public void countLines() throws UnsupportedEncodingException {
		List<String> lines = counts(sample(), false);
		assertThat(lines.size(), is(StatKind.values().length + 1));
		assertThat(lines.get(0), is("--- stats ---"));
		assertThat(lines.get(1), is("      4 (100.0% of       4) function declarations"));
		assertThat(lines.get(2), is("      1 ( 25.0% of       4) functions returning an error"));
		// no statements were seen, so the percentage falls back to 100
		assertThat(lines.get(3), is("      0 (100.0% of       0) statements"));
		assertThat(lines.get(1 + StatKind.TRY_CANDIDATE.ordinal()),
				is("      2 (100.0% of       0) try candidates (use -l flag to list file positions)"));
	}

	@Test
	public void listModeDropsTheHint() throws UnsupportedEncodingException {
		for (String line : counts(sample(), true)) {
			assertThat(line, not(containsString("-l flag")));
		}
	}

	@Test
	public void positionLists() throws UnsupportedEncodingException {
		assertThat(positions(sample()), is(Arrays.asList(
				"--- try candidates ---",
				"      1  a.go:12",
				"      2  b.go:3",
				"",
				"")));
	}

	@Test
	public void noPositionsNoOutput() throws UnsupportedEncodingException {
		Stats stats = new Stats();
		stats.count(StatKind.STMT, StatsTest.line("a.go", 1));
		assertThat(positions(stats), is(Arrays.asList("")));
	}

}
