package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import org.junit.jupiter.api.Test;

import static com.leaderboard.competition.service.scoring.ScoringFixtures.record;
import static com.leaderboard.competition.service.scoring.ScoringFixtures.split;
import static org.junit.jupiter.api.Assertions.*;

class TargetDistanceTimeResolverTest {

    private final TargetDistanceTimeResolver resolver = new TargetDistanceTimeResolver(new SplitExtractor());

    @Test
    void testResolve_InterpolationIsCappedAtTotalDuration() {
        // Arrange - km 3 at 15:00 extrapolates to 50:00 at 10 km, but the workout only lasted 2000s
        ActivityRecord record = record("w1", "alice", 10000.0, 2000, split(3, "15:00"));

        // Act
        ResolvedTime resolved = resolver.resolveDetailed(record, 10);

        // Assert
        assertTrue(resolved.getSeconds() <= 2000);
        assertEquals(2000, resolved.getSeconds());
        assertEquals(ResolvedTime.Source.INTERPOLATED_SPLIT, resolved.getSource());
    }

    @Test
    void testResolve_ExactSplitTakesPrecedence() {
        // Arrange
        ActivityRecord record = record("w1", "alice", 8000.0, 2500,
            split(1, "4:50"), split(3, "14:40"), split(5, "25:00"), split(8, "40:50"));

        // Act
        ResolvedTime resolved = resolver.resolveDetailed(record, 5);

        // Assert
        assertEquals(1500, resolved.getSeconds());
        assertEquals(ResolvedTime.Source.EXACT_SPLIT, resolved.getSource());
    }

    @Test
    void testResolve_ExactSplitIsClampedToDuration() {
        ActivityRecord record = record("w1", "alice", 5000.0, 2000, split(5, "40:00"));

        assertEquals(2000, resolver.resolve(record, 5));
    }

    @Test
    void testResolve_InterpolatesFromNearestLowerSplit() {
        // Arrange - 5:00/km through km 4
        ActivityRecord record = record("w1", "alice", 6000.0, 2000, split(2, "10:00"), split(4, "20:00"));

        // Act & Assert
        assertEquals(1500, resolver.resolve(record, 5));
        assertEquals(1650, resolver.resolve(record, 5.5));
    }

    @Test
    void testResolve_FractionalTargetSkipsExactMatch() {
        // Arrange
        ActivityRecord record = record("w1", "alice", 6000.0, 2000, split(5, "25:00"));

        // Act
        ResolvedTime resolved = resolver.resolveDetailed(record, 5.5);

        // Assert
        assertEquals(1650, resolved.getSeconds());
        assertEquals(ResolvedTime.Source.INTERPOLATED_SPLIT, resolved.getSource());
    }

    @Test
    void testResolve_AveragePaceWhenNoSplits() {
        // Arrange - 5.18 km in 31:15
        ActivityRecord record = record("w1", "alice", 5180.0, 1875);

        // Act
        ResolvedTime resolved = resolver.resolveDetailed(record, 5);

        // Assert
        assertEquals(1810, resolved.getSeconds());
        assertEquals(ResolvedTime.Source.AVERAGE_PACE, resolved.getSource());
    }

    @Test
    void testResolve_TotalDurationWhenNothingUsable() {
        // Arrange
        ActivityRecord noDistance = record("w1", "alice", null, 1900);
        ActivityRecord zeroDistance = record("w2", "alice", 0.0, 1700);

        // Act & Assert
        assertEquals(new ResolvedTime(1900, ResolvedTime.Source.TOTAL_DURATION), resolver.resolveDetailed(noDistance, 5));
        assertEquals(1700, resolver.resolve(zeroDistance, 5));
    }

    @Test
    void testResolve_SplitsOnlyBeyondTargetFallBackToDuration() {
        // Arrange
        ActivityRecord record = record("w1", "alice", 12000.0, 3700, split(10, "50:00"));

        // Act
        ResolvedTime resolved = resolver.resolveDetailed(record, 5);

        // Assert
        assertEquals(3700, resolved.getSeconds());
        assertEquals(ResolvedTime.Source.TOTAL_DURATION, resolved.getSource());
    }

    @Test
    void testResolve_UnusableSplitsBehaveAsNoSplits() {
        // Arrange - every split is malformed, so the whole-workout pace applies
        ActivityRecord record = record("w1", "alice", 10000.0, 3000, split(5, "not-a-time"));

        // Act & Assert
        assertEquals(1500, resolver.resolve(record, 5));
    }
}
