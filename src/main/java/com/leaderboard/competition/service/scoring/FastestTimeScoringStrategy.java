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
 * Best time at the target distance over records that cover (nearly) the target. Lower is better.
 */
@Component
public class FastestTimeScoringStrategy extends AbstractScoringStrategy {

    private static final Logger logger = LoggerFactory.getLogger(FastestTimeScoringStrategy.class);

    private final MemberScoreCalculator calculator;

    public FastestTimeScoringStrategy(MemberScoreCalculator calculator) {
        this.calculator = calculator;
    }

    @Override
    public ScoringMode getMode() {
        return ScoringMode.FASTEST_TIME;
    }

    @Override
    protected Optional<LeaderboardEntry> scoreParticipant(String participantId,
                                                          List<ActivityRecord> records,
                                                          ScoringContext context) {
        List<ActivityRecord> qualifying = calculator.qualifying(records, context);
        if (qualifying.isEmpty()) {
            logger.debug("No record of {} covers {} m, skipping", participantId, context.minimumQualifyingMeters());
            return Optional.empty();
        }

        return calculator.bestTime(qualifying, context.getTargetDistanceKm()).map(best -> {
            if (best.getSeconds() < best.getRecord().getDurationSeconds()) {
                logger.debug("Using {} time for {}: {} (total was {})", best.getSource(), participantId,
                    ScoreFormatter.formatDuration(best.getSeconds()),
                    ScoreFormatter.formatDuration(best.getRecord().getDurationSeconds()));
            }
            return LeaderboardEntry.builder()
                .participantId(participantId)
                .score(best.getSeconds())
                .formattedScore(ScoreFormatter.formatDuration(best.getSeconds()))
                .qualifyingWorkoutCount(qualifying.size())
                .referenceRecordId(best.getRecord().getId())
                .build();
        });
    }

    @Override
    protected Comparator<LeaderboardEntry> ordering() {
        return Comparator.comparingDouble(LeaderboardEntry::getScore);
    }
}
