package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Total distance over every record, however short. Higher is better.
 */
@Component
public class MostDistanceScoringStrategy extends AbstractScoringStrategy {

    private static final Logger logger = LoggerFactory.getLogger(MostDistanceScoringStrategy.class);

    private final MemberScoreCalculator calculator;

    public MostDistanceScoringStrategy(MemberScoreCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public ScoringMode getMode() {
        return ScoringMode.MOST_DISTANCE;
    }

    @Override
    protected Optional<LeaderboardEntry> scoreParticipant(String participantId,
                                                          List<ActivityRecord> records,
                                                          ScoringContext context) {
        double totalKm = calculator.totalDistanceKm(records);
        if (totalKm <= 0) {
            logger.debug("No distance recorded for {}, skipping", participantId);
            return Optional.empty();
        }

        return Optional.of(LeaderboardEntry.builder()
            .participantId(participantId)
            .score(totalKm)
            .formattedScore(ScoreFormatter.formatDistance(totalKm))
            .qualifyingWorkoutCount(records.size())
            .referenceRecordId(calculator.longest(records).map(ActivityRecord::getId).orElse(null))
            .build());
    }

    @Override
    protected Comparator<LeaderboardEntry> ordering() {
        return Comparator.comparingDouble(LeaderboardEntry::getScore).reversed();
    }
}
