package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.ScoringMode;
import com.leaderboard.competition.model.TeamLeaderboardEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the team board from team-tagged records. Records are grouped by team, then by member,
 * and each member contributes what the individual board would compute for them:
 * <ul>
 *     <li>most distance: the member's total kilometers</li>
 *     <li>fastest time: the member's best target-distance time (totals are summed, not relayed)</li>
 *     <li>participation: one per member with a record</li>
 * </ul>
 */
@Component
public class TeamAggregator {

    private static final Logger logger = LoggerFactory.getLogger(TeamAggregator.class);

    private static final Comparator<TeamLeaderboardEntry> LOWEST_FIRST_ZERO_LAST = (a, b) -> {
        boolean aEmpty = a.getTeamScore() == 0;
        boolean bEmpty = b.getTeamScore() == 0;
        if (aEmpty || bEmpty) {
            return Boolean.compare(aEmpty, bEmpty);
        }
        return Double.compare(a.getTeamScore(), b.getTeamScore());
    };

    private static final Comparator<TeamLeaderboardEntry> HIGHEST_FIRST =
        Comparator.comparingDouble(TeamLeaderboardEntry::getTeamScore).reversed();

    private final MemberScoreCalculator calculator;
    private final RankAssigner rankAssigner;
    private final TeamDirectory teamDirectory;

    public TeamAggregator(MemberScoreCalculator calculator, RankAssigner rankAssigner, TeamDirectory teamDirectory) {
        this.calculator = calculator;
        this.rankAssigner = rankAssigner;
        this.teamDirectory = teamDirectory;
    }

    public List<TeamLeaderboardEntry> aggregate(List<ActivityRecord> records, ScoringMode mode, ScoringContext context) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(context, "context");

        Map<String, Map<String, List<ActivityRecord>>> byTeamAndMember = groupByTeamAndMember(records);
        logger.debug("Found records for {} teams", byTeamAndMember.size());

        List<TeamLeaderboardEntry> entries = new ArrayList<>(byTeamAndMember.size());
        for (Map.Entry<String, Map<String, List<ActivityRecord>>> team : byTeamAndMember.entrySet()) {
            String teamId = team.getKey();
            Map<String, List<ActivityRecord>> members = team.getValue();
            double teamScore = teamScore(members, mode, context);
            entries.add(TeamLeaderboardEntry.builder()
                .teamId(teamId)
                .teamName(teamDirectory.displayName(teamId))
                .teamScore(teamScore)
                .formattedScore(ScoreFormatter.formatTeamScore(teamScore, mode))
                .memberCount(members.size())
                .build());
        }

        entries.sort(mode == ScoringMode.FASTEST_TIME ? LOWEST_FIRST_ZERO_LAST : HIGHEST_FIRST);
        return rankAssigner.assignTeamRanks(entries);
    }

    private Map<String, Map<String, List<ActivityRecord>>> groupByTeamAndMember(List<ActivityRecord> records) {
        Map<String, Map<String, List<ActivityRecord>>> grouped = new LinkedHashMap<>();
        for (ActivityRecord record : records) {
            if (record == null || !record.hasTeam()) {
                continue;
            }
            if (!teamDirectory.accepts(record.getTeamId())) {
                logger.debug("Skipping record {} for unknown team {}", record.getId(), record.getTeamId());
                continue;
            }
            if (record.getParticipantId() == null || record.getParticipantId().isBlank()) {
                logger.debug("Skipping record {} without a participant", record.getId());
                continue;
            }
            grouped.computeIfAbsent(record.getTeamId(), teamId -> new LinkedHashMap<>())
                .computeIfAbsent(record.getParticipantId(), participantId -> new ArrayList<>())
                .add(record);
        }
        return grouped;
    }

    private double teamScore(Map<String, List<ActivityRecord>> members, ScoringMode mode, ScoringContext context) {
        switch (mode) {
            case MOST_DISTANCE: {
                double totalKm = 0.0;
                for (List<ActivityRecord> memberRecords : members.values()) {
                    totalKm += calculator.totalDistanceKm(memberRecords);
                }
                return totalKm;
            }
            case FASTEST_TIME: {
                long totalSeconds = 0L;
                for (List<ActivityRecord> memberRecords : members.values()) {
                    totalSeconds += calculator.bestTime(memberRecords, context.getTargetDistanceKm())
                        .map(MemberScoreCalculator.BestTime::getSeconds)
                        .orElse(0L);
                }
                return totalSeconds;
            }
            case PARTICIPATION:
            default:
                return members.size();
        }
    }
}
