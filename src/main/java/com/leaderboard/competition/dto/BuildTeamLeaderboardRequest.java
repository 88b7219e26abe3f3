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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildTeamLeaderboardRequest {
    @NotNull(message = "Scoring mode cannot be null")
    private ScoringMode mode;

    private Double targetDistance;

    private DistanceUnit targetDistanceUnit;

    @NotNull(message = "Records cannot be null")
    private List<@Valid ActivityRecordRequest> records;
}
