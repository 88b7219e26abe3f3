package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;

import java.util.List;
import java.util.Map;

public interface ScoringStrategy {

    ScoringMode getMode();

    /**
     * Scores every participant that qualifies under this mode.
     *
     * @return entries sorted by this mode's ordering; ranks are not yet final
     */
    List<LeaderboardEntry> score(Map<String, List<ActivityRecord>> recordsByParticipant, ScoringContext context);
}
