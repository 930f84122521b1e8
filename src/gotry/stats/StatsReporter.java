package gotry.stats;

import gotry.util.SourceLocation;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

public class StatsReporter {

	private final Stats stats;
	private final boolean listMode;

	/**
	 * @param listMode whether positions are being listed, which drops the hint pointing at -l
	 */
	public StatsReporter(Stats stats, boolean listMode) {
		this.stats = stats;
		this.listMode = listMode;
	}

	/**
	 * Prints, for each kind that recorded any positions, a numbered list of "file:line" entries
	 */
	public void reportPositions(PrintStream out) {
		for (StatKind kind : StatKind.values()) {
			List<SourceLocation> positions = stats.getPositions(kind);
			if (positions.isEmpty()) {
				continue;
			}
			out.printf("--- %s ---%n", kind.getDescription());
			int i = 0;
			for (SourceLocation position : positions) {
				out.printf(Locale.ROOT, "%7d  %s%n", ++i, position.shortString());
			}
			out.println();
		}
	}

	public void reportCounts(PrintStream out) {
		out.println("--- stats ---");
		for (StatKind kind : StatKind.values()) {
			int count = stats.getCount(kind);
			int total = stats.getCount(kind.getParent());
			double percentage = 100.0;
			if (total != 0) {
				percentage = count * 100.0 / total;
			}
			String hint = "";
			if (!listMode && kind.recordsPositions()) {
				hint = " (use -l flag to list file positions)";
			}
			out.printf(Locale.ROOT, "%7d (%5.1f%% of %7d) %s%s%n", count, percentage, total, kind.getDescription(), hint);
		}
	}

}
