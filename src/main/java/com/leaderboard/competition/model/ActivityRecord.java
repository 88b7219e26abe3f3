package com.leaderboard.competition.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One completed workout attributed to one participant.
 */
@Value
@Builder(toBuilder = true)
public class ActivityRecord {
    String id;
    String participantId;
    /** Recorded distance in meters; {@code null} when the workout carried none. */
    Double distanceMeters;
    long durationSeconds;
    @Singular
    List<SplitAnnotation> splitAnnotations;
    String teamId;

    /**
     * Distance in meters with an absent value read as 0.
     */
    public double distanceOrZero() {
        return distanceMeters == null ? 0.0 : distanceMeters;
    }

    public boolean hasTeam() {
        return teamId != null && !teamId.isBlank();
    }
}
