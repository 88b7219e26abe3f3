package com.leaderboard.competition.service.scoring;

import lombok.Value;

/**
 * Estimated elapsed seconds at a target distance, with the rule that produced it.
 */
@Value
public class ResolvedTime {

    public enum Source {
        EXACT_SPLIT,
        INTERPOLATED_SPLIT,
        AVERAGE_PACE,
        TOTAL_DURATION
    }

    long seconds;
    Source source;
}
