package com.leaderboard.competition.service.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Per-invocation scoring parameters, already resolved from request and configuration.
 */
@Value
@Builder
public class ScoringContext {
    double targetDistanceKm;
    @Builder.Default
    double qualifyingRatio = 0.95;
    boolean parallel;

    public double minimumQualifyingMeters() {
        return targetDistanceKm * 1000 * qualifyingRatio;
    }
}
