package com.leaderboard.competition.service;

import com.leaderboard.competition.config.ScoringProperties;
import com.leaderboard.competition.exception.InvalidRequestException;
import com.leaderboard.competition.exception.LeaderboardException;
import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import com.leaderboard.competition.model.TeamLeaderboardEntry;
import com.leaderboard.competition.service.scoring.ParticipantBackfill;
import com.leaderboard.competition.service.scoring.RankAssigner;
import com.leaderboard.competition.service.scoring.ScoringContext;
import com.leaderboard.competition.service.scoring.ScoringStrategy;
import com.leaderboard.competition.service.scoring.TeamAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point of the scoring engine. Every call is a pure function of its arguments: records
 * are never stored and results are never cached, so concurrent callers need no coordination.
 */
@Service
public class LeaderboardService {

    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    static final String SCORING_FAILED = "SCORING_FAILED";

    private final Map<ScoringMode, ScoringStrategy> strategies;
    private final RankAssigner rankAssigner;
    private final ParticipantBackfill participantBackfill;
    private final TeamAggregator teamAggregator;
    private final ScoringProperties properties;

    @Autowired
    public LeaderboardService(
            List<ScoringStrategy> strategies,
            RankAssigner rankAssigner,
            ParticipantBackfill participantBackfill,
            TeamAggregator teamAggregator,
            ScoringProperties properties) {
        this.strategies = indexByMode(strategies);
        this.rankAssigner = rankAssigner;
        this.participantBackfill = participantBackfill;
        this.teamAggregator = teamAggregator;
        this.properties = properties;
    }

    private static Map<ScoringMode, ScoringStrategy> indexByMode(List<ScoringStrategy> strategies) {
        Map<ScoringMode, ScoringStrategy> byMode = new EnumMap<>(ScoringMode.class);
        for (ScoringStrategy strategy : strategies) {
            ScoringStrategy previous = byMode.put(strategy.getMode(), strategy);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scoring strategy for mode " + strategy.getMode());
            }
        }
        for (ScoringMode mode : ScoringMode.values()) {
            if (!byMode.containsKey(mode)) {
                throw new IllegalStateException("No scoring strategy registered for mode " + mode);
            }
        }
        return byMode;
    }

    public List<LeaderboardEntry> buildLeaderboard(Map<String, List<ActivityRecord>> records, ScoringMode mode) {
        return buildLeaderboard(records, mode, null, null);
    }

    /**
     * Build an individual leaderboard.
     * Scores participants with the mode's strategy, ranks them, then appends every roster
     * member without an entry at a shared trailing rank.
     *
     * @param targetDistanceKm target for fastest time; {@code null} or 0 uses the configured default
     * @param allParticipants optional roster; {@code null} leaves the board as scored
     */
    public List<LeaderboardEntry> buildLeaderboard(
            Map<String, List<ActivityRecord>> records,
            ScoringMode mode,
            Double targetDistanceKm,
            List<String> allParticipants) {
        validateBuildLeaderboardRequest(records, mode);
        ScoringContext context = scoringContext(targetDistanceKm,
            records.size() >= properties.getParallelThreshold());

        ScoringStrategy strategy = strategies.get(mode);
        List<LeaderboardEntry> scored = scoringStep(mode, () -> strategy.score(records, context));
        List<LeaderboardEntry> ranked = rankAssigner.assignRanks(scored, mode);
        List<LeaderboardEntry> entries = participantBackfill.backfill(ranked, allParticipants, mode);

        logger.info("Built {} leaderboard - participantsWithRecords: {}, roster: {}, target: {}km, ranked: {}, backfilled: {}",
            mode.getWireValue(), records.size(), allParticipants == null ? 0 : allParticipants.size(),
            context.getTargetDistanceKm(), ranked.size(), entries.size() - ranked.size());
        return entries;
    }

    private void validateBuildLeaderboardRequest(Map<String, List<ActivityRecord>> records, ScoringMode mode) {
        if (records == null) {
            throw new InvalidRequestException("Records cannot be null");
        }
        if (mode == null) {
            throw new InvalidRequestException("Scoring mode cannot be null");
        }
        for (Map.Entry<String, List<ActivityRecord>> entry : records.entrySet()) {
            if (entry.getKey() == null || entry.getKey().trim().isEmpty()) {
                throw new InvalidRequestException("ParticipantId cannot be null or empty");
            }
            if (entry.getValue() == null) {
                throw new InvalidRequestException("Records for participant " + entry.getKey() + " cannot be null");
            }
        }
    }

    public List<TeamLeaderboardEntry> buildTeamLeaderboard(List<ActivityRecord> records, ScoringMode mode) {
        return buildTeamLeaderboard(records, mode, null);
    }

    /**
     * Build a team leaderboard from team-tagged records. Untagged records are ignored.
     */
    public List<TeamLeaderboardEntry> buildTeamLeaderboard(
            List<ActivityRecord> records,
            ScoringMode mode,
            Double targetDistanceKm) {
        if (records == null) {
            throw new InvalidRequestException("Records cannot be null");
        }
        if (mode == null) {
            throw new InvalidRequestException("Scoring mode cannot be null");
        }
        ScoringContext context = scoringContext(targetDistanceKm, false);

        List<TeamLeaderboardEntry> teams = scoringStep(mode, () -> teamAggregator.aggregate(records, mode, context));

        logger.info("Built {} team leaderboard - records: {}, teams ranked: {}",
            mode.getWireValue(), records.size(), teams.size());
        return teams;
    }

    /**
     * Target distance actually used for a request: the configured default when none (or 0)
     * is given.
     */
    public double effectiveTargetDistanceKm(Double requestedKm) {
        if (requestedKm == null || requestedKm == 0) {
            return properties.getDefaultTargetDistanceKm();
        }
        if (requestedKm.isNaN() || requestedKm.isInfinite() || requestedKm < 0) {
            throw new InvalidRequestException("Target distance must be a positive number of kilometers");
        }
        return requestedKm;
    }

    /**
     * Runs an engine step, reporting unexpected failures as {@code SCORING_FAILED}.
     * Request errors pass through unchanged.
     */
    private <T> T scoringStep(ScoringMode mode, Supplier<T> step) {
        try {
            return step.get();
        } catch (LeaderboardException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LeaderboardException(
                "Failed to score " + mode.getWireValue() + " leaderboard: " + e.getMessage(), SCORING_FAILED, e);
        }
    }

    private ScoringContext scoringContext(Double targetDistanceKm, boolean parallel) {
        return ScoringContext.builder()
            .targetDistanceKm(effectiveTargetDistanceKm(targetDistanceKm))
            .qualifyingRatio(properties.getQualifyingRatio())
            .parallel(parallel)
            .build();
    }
}
