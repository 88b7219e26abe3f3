package com.leaderboard.competition.dto;

import com.leaderboard.competition.model.DistanceUnit;
import com.leaderboard.competition.model.ScoringMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildLeaderboardRequest {
    @NotNull(message = "Scoring mode cannot be null")
    private ScoringMode mode;

    private Double targetDistance;

    private DistanceUnit targetDistanceUnit;

    /** Full roster; members without a qualifying record are appended at the bottom. */
    private List<String> participants;

    @NotNull(message = "Records cannot be null")
    private Map<String, List<@Valid ActivityRecordRequest>> records;
}
