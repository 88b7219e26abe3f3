package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.ScoringMode;
import com.leaderboard.competition.model.TeamLeaderboardEntry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.leaderboard.competition.service.scoring.ScoringFixtures.context;
import static com.leaderboard.competition.service.scoring.ScoringFixtures.record;
import static com.leaderboard.competition.service.scoring.ScoringFixtures.teamRecord;
import static org.junit.jupiter.api.Assertions.*;

class TeamAggregatorTest {

    private final TeamAggregator aggregator = aggregator(TeamDirectory.open());

    @Test
    void testAggregate_MostDistanceSumsMembers() {
        // Arrange
        List<ActivityRecord> records = List.of(
            teamRecord("a1", "alice", "red", 1000.0, 400),
            teamRecord("a2", "alice", "red", 2500.0, 900),
            teamRecord("b1", "bob", "red", 4000.0, 1300),
            teamRecord("c1", "carol", "blue", 9000.0, 2700),
            record("d1", "dave", 50000.0, 9000));

        // Act
        List<TeamLeaderboardEntry> teams = aggregator.aggregate(records, ScoringMode.MOST_DISTANCE, context(5));

        // Assert
        assertEquals(2, teams.size());
        TeamLeaderboardEntry first = teams.get(0);
        assertEquals("blue", first.getTeamId());
        assertEquals(1, first.getRank());
        assertEquals("9.00 km", first.getFormattedScore());
        TeamLeaderboardEntry second = teams.get(1);
        assertEquals("red", second.getTeamId());
        assertEquals(2, second.getRank());
        assertEquals(7.5, second.getTeamScore(), 1e-9);
        assertEquals(2, second.getMemberCount());
        assertEquals("red", second.getTeamName());
    }

    @Test
    void testAggregate_FastestTimeSumsBestTimesAndPushesEmptyTeamsLast() {
        // Arrange
        List<ActivityRecord> records = List.of(
            teamRecord("g1", "gina", "green", null, 0),
            teamRecord("a1", "alice", "red", 5000.0, 1500),
            teamRecord("a2", "alice", "red", 5000.0, 1400),
            teamRecord("b1", "bob", "red", 5000.0, 1600),
            teamRecord("c1", "carol", "blue", 5000.0, 1200));

        // Act
        List<TeamLeaderboardEntry> teams = aggregator.aggregate(records, ScoringMode.FASTEST_TIME, context(5));

        // Assert
        assertEquals(List.of("blue", "red", "green"), teams.stream().map(TeamLeaderboardEntry::getTeamId).toList());
        assertEquals(1200.0, teams.get(0).getTeamScore());
        assertEquals(3000.0, teams.get(1).getTeamScore());
        assertEquals("50:00", teams.get(1).getFormattedScore());
        assertEquals(0.0, teams.get(2).getTeamScore());
        assertEquals("--:--", teams.get(2).getFormattedScore());
        assertEquals(3, teams.get(2).getRank());
    }

    @Test
    void testAggregate_ParticipationCountsDistinctMembers() {
        // Arrange
        List<ActivityRecord> records = List.of(
            teamRecord("a1", "alice", "red", 1000.0, 400),
            teamRecord("a2", "alice", "red", 1000.0, 400),
            teamRecord("c1", "carol", "blue", 1000.0, 400),
            teamRecord("d1", "dave", "blue", 1000.0, 400));

        // Act
        List<TeamLeaderboardEntry> teams = aggregator.aggregate(records, ScoringMode.PARTICIPATION, context(5));

        // Assert
        assertEquals("blue", teams.get(0).getTeamId());
        assertEquals("2 members", teams.get(0).getFormattedScore());
        assertEquals("red", teams.get(1).getTeamId());
        assertEquals("1 member", teams.get(1).getFormattedScore());
        assertEquals(2, teams.get(1).getRank());
    }

    @Test
    void testAggregate_RestrictedDirectorySkipsUnknownTeams() {
        // Arrange
        TeamAggregator restricted = aggregator(new TeamDirectory(Map.of("red", "Red Runners"), true));
        List<ActivityRecord> records = List.of(
            teamRecord("a1", "alice", "red", 1000.0, 400),
            teamRecord("c1", "carol", "blue", 9000.0, 2700));

        // Act
        List<TeamLeaderboardEntry> teams = restricted.aggregate(records, ScoringMode.MOST_DISTANCE, context(5));

        // Assert
        assertEquals(1, teams.size());
        assertEquals("Red Runners", teams.get(0).getTeamName());
    }

    @Test
    void testAggregate_RecordsWithoutParticipantIgnored() {
        // Arrange
        List<ActivityRecord> records = List.of(
            teamRecord("x1", null, "red", 9000.0, 2700),
            teamRecord("a1", "alice", "red", 1000.0, 400));

        // Act
        List<TeamLeaderboardEntry> teams = aggregator.aggregate(records, ScoringMode.MOST_DISTANCE, context(5));

        // Assert
        assertEquals(1.0, teams.get(0).getTeamScore(), 1e-9);
        assertEquals(1, teams.get(0).getMemberCount());
    }

    @Test
    void testAggregate_NoTeamRecordsYieldsEmptyBoard() {
        assertTrue(aggregator.aggregate(List.of(record("a1", "alice", 5000.0, 1500)),
            ScoringMode.MOST_DISTANCE, context(5)).isEmpty());
    }

    private static TeamAggregator aggregator(TeamDirectory directory) {
        return new TeamAggregator(ScoringFixtures.calculator(), new RankAssigner(), directory);
    }
}
