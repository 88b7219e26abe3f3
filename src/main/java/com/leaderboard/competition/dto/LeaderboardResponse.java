package com.leaderboard.competition.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardResponse {
    private ScoringMode mode;
    private Double targetDistanceKm;
    private List<LeaderboardEntry> entries;
    private Integer totalEntries;
    
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant computedAt;
}
