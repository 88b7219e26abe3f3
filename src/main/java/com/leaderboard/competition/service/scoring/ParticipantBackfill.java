package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Makes a leaderboard total over the roster: members with no entry are appended with a zero
 * score, all sharing the rank right after the last participant with a qualifying workout.
 */
@Component
public class ParticipantBackfill {

    private static final Logger logger = LoggerFactory.getLogger(ParticipantBackfill.class);

    public List<LeaderboardEntry> backfill(List<LeaderboardEntry> ranked, Collection<String> roster, ScoringMode mode) {
        Objects.requireNonNull(ranked, "ranked");
        Objects.requireNonNull(mode, "mode");
        if (roster == null || roster.isEmpty()) {
            return ranked;
        }

        Set<String> present = ranked.stream()
            .map(LeaderboardEntry::getParticipantId)
            .collect(Collectors.toSet());
        int trailingRank = (int) ranked.stream().filter(LeaderboardEntry::hasQualifyingWorkout).count() + 1;
        String placeholder = ScoreFormatter.placeholder(mode);

        List<LeaderboardEntry> result = new ArrayList<>(ranked);
        for (String participantId : new LinkedHashSet<>(roster)) {
            if (participantId == null || present.contains(participantId)) {
                continue;
            }
            result.add(LeaderboardEntry.builder()
                .rank(trailingRank)
                .participantId(participantId)
                .score(0)
                .formattedScore(placeholder)
                .qualifyingWorkoutCount(0)
                .build());
        }

        int added = result.size() - ranked.size();
        if (added > 0) {
            logger.debug("Backfilled {} participants at rank {}", added, trailingRank);
        }
        return List.copyOf(result);
    }
}
