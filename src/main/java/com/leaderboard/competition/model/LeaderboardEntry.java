package com.leaderboard.competition.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * One row of an individual leaderboard. Score units depend on the mode: seconds for
 * fastest time, kilometers for most distance, workout count for participation.
 */
@Value
@Builder
public class LeaderboardEntry {
    @With
    int rank;
    String participantId;
    double score;
    String formattedScore;
    int qualifyingWorkoutCount;
    String referenceRecordId;

    public boolean hasQualifyingWorkout() {
        return qualifyingWorkoutCount > 0;
    }
}
