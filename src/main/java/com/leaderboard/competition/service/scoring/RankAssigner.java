package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import com.leaderboard.competition.model.TeamLeaderboardEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes 1-based positional ranks onto already sorted entries. Participation entries arrive
 * with their shared rank and are passed through.
 */
@Component
public class RankAssigner {

    public List<LeaderboardEntry> assignRanks(List<LeaderboardEntry> sorted, ScoringMode mode) {
        Objects.requireNonNull(sorted, "sorted");
        if (mode == ScoringMode.PARTICIPATION) {
            return List.copyOf(sorted);
        }
        List<LeaderboardEntry> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }

    public List<TeamLeaderboardEntry> assignTeamRanks(List<TeamLeaderboardEntry> sorted) {
        Objects.requireNonNull(sorted, "sorted");
        List<TeamLeaderboardEntry> ranked = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            ranked.add(sorted.get(i).withRank(i + 1));
        }
        return List.copyOf(ranked);
    }
}
