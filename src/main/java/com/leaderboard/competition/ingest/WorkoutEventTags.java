package com.leaderboard.competition.ingest;

import com.leaderboard.competition.model.SplitAnnotation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads the tags a workout event is published with, e.g.
 * {@code [["split", "5", "00:25:30"], ["team", "<team id>"]]}.
 */
public final class WorkoutEventTags {

    public static final String SPLIT = "split";
    public static final String TEAM = "team";

    private WorkoutEventTags() {
    }

    /**
     * Split tags in published order. Only the mark and the elapsed time are kept; their
     * values are validated later, when splits are extracted.
     */
    public static List<SplitAnnotation> splitAnnotations(List<List<String>> tags) {
        List<SplitAnnotation> splits = new ArrayList<>();
        if (tags == null) {
            return splits;
        }
        for (List<String> tag : tags) {
            if (tag != null && tag.size() >= 3 && SPLIT.equals(tag.get(0))) {
                splits.add(new SplitAnnotation(tag.get(1), tag.get(2)));
            }
        }
        return splits;
    }

    public static Optional<String> teamId(List<List<String>> tags) {
        if (tags == null) {
            return Optional.empty();
        }
        return tags.stream()
            .filter(tag -> tag != null && tag.size() >= 2 && TEAM.equals(tag.get(0)))
            .map(tag -> tag.get(1))
            .filter(value -> value != null && !value.isBlank())
            .findFirst();
    }
}
