package com.leaderboard.competition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A raw split checkpoint as published with a workout: the kilometer mark and the
 * elapsed time at that mark, both still in their textual form ({@code "5"}, {@code "00:25:30"}).
 * Validation happens when splits are extracted, not here.
 */
@Value
public class SplitAnnotation {
    String kilometerMark;
    String elapsed;

    @JsonCreator
    public SplitAnnotation(@JsonProperty("kilometerMark") String kilometerMark,
                           @JsonProperty("elapsed") String elapsed) {
        this.kilometerMark = kilometerMark;
        this.elapsed = elapsed;
    }

    public static SplitAnnotation of(int kilometerMark, String elapsed) {
        return new SplitAnnotation(String.valueOf(kilometerMark), elapsed);
    }
}
