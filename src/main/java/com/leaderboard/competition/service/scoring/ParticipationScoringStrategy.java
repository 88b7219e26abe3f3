package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Anyone with a record is in, and everyone shares rank 1. The workout count is shown but
 * does not rank; entries are ordered by participant id only so output is reproducible.
 */
@Component
public class ParticipationScoringStrategy extends AbstractScoringStrategy {

    static final int SHARED_RANK = 1;

    // Alphabetical ignoring case; ids differing only in case keep a fixed order.
    private static final Comparator<String> ALPHABETICAL =
        String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());

    @Override
    public ScoringMode getMode() {
        return ScoringMode.PARTICIPATION;
    }

    @Override
    protected Optional<LeaderboardEntry> scoreParticipant(String participantId,
                                                          List<ActivityRecord> records,
                                                          ScoringContext context) {
        if (records.isEmpty()) {
            return Optional.empty();
        }
        int workoutCount = records.size();
        return Optional.of(LeaderboardEntry.builder()
            .rank(SHARED_RANK)
            .participantId(participantId)
            .score(workoutCount)
            .formattedScore(ScoreFormatter.formatWorkoutCount(workoutCount))
            .qualifyingWorkoutCount(workoutCount)
            .referenceRecordId(records.get(0).getId())
            .build());
    }

    @Override
    protected Comparator<LeaderboardEntry> ordering() {
        return Comparator.comparing(LeaderboardEntry::getParticipantId, ALPHABETICAL);
    }
}
