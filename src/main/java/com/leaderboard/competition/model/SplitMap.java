package com.leaderboard.competition.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * Kilometer mark to elapsed seconds for a single record. Keys and values are both
 * strictly increasing; instances are immutable.
 */
public final class SplitMap {

    private static final SplitMap EMPTY = new SplitMap(new TreeMap<>());

    private final NavigableMap<Integer, Long> splits;

    private SplitMap(NavigableMap<Integer, Long> splits) {
        this.splits = Collections.unmodifiableNavigableMap(splits);
    }

    public static SplitMap empty() {
        return EMPTY;
    }

    /**
     * Builds a map from already validated entries, dropping any entry whose time does not
     * increase over the previous (lower) mark.
     */
    public static SplitMap of(Map<Integer, Long> entries) {
        if (entries.isEmpty()) {
            return EMPTY;
        }
        NavigableMap<Integer, Long> sorted = new TreeMap<>(entries);
        NavigableMap<Integer, Long> monotonic = new TreeMap<>();
        long previous = 0L;
        for (Map.Entry<Integer, Long> entry : sorted.entrySet()) {
            if (entry.getKey() > 0 && entry.getValue() > previous) {
                monotonic.put(entry.getKey(), entry.getValue());
                previous = entry.getValue();
            }
        }
        return monotonic.isEmpty() ? EMPTY : new SplitMap(monotonic);
    }

    public boolean isEmpty() {
        return splits.isEmpty();
    }

    public int size() {
        return splits.size();
    }

    public OptionalLong at(int kilometerMark) {
        Long seconds = splits.get(kilometerMark);
        return seconds == null ? OptionalLong.empty() : OptionalLong.of(seconds);
    }

    /**
     * Largest recorded mark at or below the given distance.
     */
    public Map.Entry<Integer, Long> floor(double kilometers) {
        if (kilometers < 1) {
            return null;
        }
        return splits.floorEntry((int) Math.floor(kilometers));
    }

    public NavigableMap<Integer, Long> asMap() {
        return splits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SplitMap)) {
            return false;
        }
        return splits.equals(((SplitMap) o).splits);
    }

    @Override
    public int hashCode() {
        return splits.hashCode();
    }

    @Override
    public String toString() {
        return "SplitMap" + splits;
    }
}
