package com.leaderboard.competition.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
public class TeamLeaderboardEntry {
    @With
    int rank;
    String teamId;
    String teamName;
    double teamScore;
    String formattedScore;
    int memberCount;
}
