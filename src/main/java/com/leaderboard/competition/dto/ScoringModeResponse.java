package com.leaderboard.competition.dto;

import com.leaderboard.competition.model.ScoringMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringModeResponse {
    private ScoringMode mode;
    private String label;
    private String description;
    private boolean requiresTargetDistance;

    public static ScoringModeResponse from(ScoringMode mode) {
        return ScoringModeResponse.builder()
            .mode(mode)
            .label(mode.getLabel())
            .description(mode.getDescription())
            .requiresTargetDistance(mode.requiresTargetDistance())
            .build();
    }
}
