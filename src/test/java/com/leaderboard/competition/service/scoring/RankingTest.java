package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankingTest {

    private final RankAssigner rankAssigner = new RankAssigner();
    private final ParticipantBackfill backfill = new ParticipantBackfill();

    @Test
    void testAssignRanks_PositionalAndOneBased() {
        // Arrange
        List<LeaderboardEntry> sorted = List.of(entry("a", 1200), entry("b", 1500), entry("c", 1500));

        // Act
        List<LeaderboardEntry> ranked = rankAssigner.assignRanks(sorted, ScoringMode.FASTEST_TIME);

        // Assert
        assertEquals(1, ranked.get(0).getRank());
        assertEquals(2, ranked.get(1).getRank());
        assertEquals(3, ranked.get(2).getRank());
        assertEquals(0, sorted.get(0).getRank(), "input entries are never modified");
    }

    @Test
    void testAssignRanks_ParticipationUntouched() {
        // Arrange
        List<LeaderboardEntry> sorted = List.of(entry("a", 2).withRank(1), entry("b", 1).withRank(1));

        // Act
        List<LeaderboardEntry> ranked = rankAssigner.assignRanks(sorted, ScoringMode.PARTICIPATION);

        // Assert
        assertEquals(sorted, ranked);
    }

    @Test
    void testBackfill_RosterMembersShareTrailingRank() {
        // Arrange
        List<LeaderboardEntry> ranked = List.of(entry("A", 3.5).withRank(1));

        // Act
        List<LeaderboardEntry> result = backfill.backfill(ranked, List.of("A", "B", "C"), ScoringMode.MOST_DISTANCE);

        // Assert
        assertEquals(3, result.size());
        assertEquals(1, result.get(0).getRank());
        assertEquals("B", result.get(1).getParticipantId());
        assertEquals(2, result.get(1).getRank());
        assertEquals("C", result.get(2).getParticipantId());
        assertEquals(2, result.get(2).getRank());
        assertEquals(0.0, result.get(1).getScore());
        assertEquals(0, result.get(1).getQualifyingWorkoutCount());
        assertEquals("0.00 km", result.get(1).getFormattedScore());
        assertNull(result.get(1).getReferenceRecordId());
    }

    @Test
    void testBackfill_DuplicateRosterIdsAddedOnce() {
        List<LeaderboardEntry> result = backfill.backfill(List.of(), List.of("B", "B", "C"), ScoringMode.FASTEST_TIME);

        assertEquals(2, result.size());
        result.forEach(entry -> {
            assertEquals(1, entry.getRank());
            assertEquals("--:--", entry.getFormattedScore());
        });
    }

    @Test
    void testBackfill_NoRosterLeavesBoardAsIs() {
        List<LeaderboardEntry> ranked = List.of(entry("A", 3.5).withRank(1));

        assertSame(ranked, backfill.backfill(ranked, null, ScoringMode.MOST_DISTANCE));
        assertSame(ranked, backfill.backfill(ranked, List.of(), ScoringMode.MOST_DISTANCE));
    }

    private static LeaderboardEntry entry(String participantId, double score) {
        return LeaderboardEntry.builder()
            .participantId(participantId)
            .score(score)
            .formattedScore(String.valueOf(score))
            .qualifyingWorkoutCount(1)
            .referenceRecordId(participantId + "-r")
            .build();
    }
}
