package gotry.stats;

import gotry.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts and positions for each {@link StatKind}. An instance is owned by whoever drives the analysis and is not
 * thread-safe; independent accumulators can be combined with {@link #merge(Stats)}.
 */
public class Stats {

	private final Map<StatKind, Integer> counts = new EnumMap<>(StatKind.class);
	private final Map<StatKind, List<SourceLocation>> positions = new EnumMap<>(StatKind.class);

	public Stats() {
		for (StatKind kind : StatKind.values()) {
			counts.put(kind, 0);
			positions.put(kind, new ArrayList<>());
		}
	}

	/**
	 * Counts one occurrence of kind, recording location if the kind records positions
	 */
	public void count(StatKind kind, SourceLocation location) {
		counts.put(kind, counts.get(kind) + 1);
		if (kind.recordsPositions()) {
			positions.get(kind).add(location);
		}
	}

	public int getCount(StatKind kind) {
		return counts.get(kind);
	}

	public List<SourceLocation> getPositions(StatKind kind) {
		return Collections.unmodifiableList(positions.get(kind));
	}

	/**
	 * Appends the counts and positions of other to this accumulator, positions keeping their order
	 */
	public void merge(Stats other) {
		for (StatKind kind : StatKind.values()) {
			counts.put(kind, counts.get(kind) + other.getCount(kind));
			positions.get(kind).addAll(other.getPositions(kind));
		}
	}

}
