package com.leaderboard.competition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a competition turns activity records into standings.
 * Closed set: an unrecognized mode cannot be constructed.
 */
public enum ScoringMode {
    FASTEST_TIME("fastest_time", "Time", "Fastest time to complete target distance", true),
    MOST_DISTANCE("most_distance", "Distance", "Highest total distance accumulated", false),
    PARTICIPATION("participation", "Workouts", "Complete any qualifying workout to participate", false);

    private final String wireValue;
    private final String label;
    private final String description;
    private final boolean requiresTargetDistance;

    ScoringMode(String wireValue, String label, String description, boolean requiresTargetDistance) {
        this.wireValue = wireValue;
        this.label = label;
        this.description = description;
        this.requiresTargetDistance = requiresTargetDistance;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    public boolean requiresTargetDistance() {
        return requiresTargetDistance;
    }

    /**
     * Accepts the wire form ({@code fastest_time}) or the constant name in any case,
     * with or without underscores ({@code FastestTime}, {@code FASTEST_TIME}).
     *
     * @throws IllegalArgumentException if the value names no mode
     */
    @JsonCreator
    public static ScoringMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Scoring mode cannot be null or empty");
        }
        String normalized = normalize(value);
        for (ScoringMode mode : values()) {
            if (normalize(mode.wireValue).equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scoring mode: " + value);
    }

    private static String normalize(String value) {
        return value.trim().replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
    }
}
