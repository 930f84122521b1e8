package gotry.stats;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

import gotry.util.SourceLocation;

public class StatsTest {

	static SourceLocation line(String file, int line) {
		return new SourceLocation(Paths.get(file), 0, 1, line, line, 1, 2);
	}

	@Test
	public void startsAtZero() {
		Stats stats = new Stats();
		for (StatKind kind : StatKind.values()) {
			assertThat(stats.getCount(kind), is(0));
			assertThat(stats.getPositions(kind).isEmpty(), is(true));
		}
	}

	@Test
	public void onlyReportingKindsRecordPositions() {
		Stats stats = new Stats();
		stats.count(StatKind.STMT, line("a.go", 1));
		stats.count(StatKind.STMT, line("a.go", 2));
		stats.count(StatKind.TRY_CANDIDATE, line("a.go", 3));
		assertThat(stats.getCount(StatKind.STMT), is(2));
		assertThat(stats.getPositions(StatKind.STMT).isEmpty(), is(true));
		assertThat(stats.getCount(StatKind.TRY_CANDIDATE), is(1));
		assertThat(stats.getPositions(StatKind.TRY_CANDIDATE), hasItems(line("a.go", 3)));
	}

	@Test(expected = UnsupportedOperationException.class)
	public void positionsAreReadOnly() {
		new Stats().getPositions(StatKind.HAS_ELSE).add(line("a.go", 1));
	}

	@Test
	public void mergeKeepsOrder() {
		Stats first = new Stats();
		first.count(StatKind.FUNC, line("a.go", 1));
		first.count(StatKind.HAS_ELSE, line("a.go", 5));
		Stats second = new Stats();
		second.count(StatKind.FUNC, line("b.go", 1));
		second.count(StatKind.HAS_ELSE, line("b.go", 7));

		first.merge(second);
		assertThat(first.getCount(StatKind.FUNC), is(2));
		assertThat(first.getPositions(StatKind.HAS_ELSE).get(0).shortString(), is("a.go:5"));
		assertThat(first.getPositions(StatKind.HAS_ELSE).get(1).shortString(), is("b.go:7"));
		assertThat(second.getCount(StatKind.FUNC), is(1));
	}

	@Test
	public void parents() {
		assertThat(StatKind.FUNC.getParent(), is(StatKind.FUNC));
		assertThat(StatKind.FUNC_ERROR.getParent(), is(StatKind.FUNC));
		assertThat(StatKind.IF.getParent(), is(StatKind.STMT));
		assertThat(StatKind.IF_ERR.getParent(), is(StatKind.IF));
		assertThat(StatKind.TRY_CANDIDATE.getParent(), is(StatKind.IF_ERR));
		assertThat(StatKind.SHARED_RETURN.getParent(), is(StatKind.IF_ERR));
	}

}
