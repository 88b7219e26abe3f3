package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Per-member arithmetic shared by the individual strategies and the team aggregator, so a
 * team total is always built from the same numbers its members see on the individual board.
 */
@Component
public class MemberScoreCalculator {

    private final TargetDistanceTimeResolver timeResolver;

    public MemberScoreCalculator(TargetDistanceTimeResolver timeResolver) {
        this.timeResolver = timeResolver;
    }

    public List<ActivityRecord> qualifying(List<ActivityRecord> records, ScoringContext context) {
        double minimumMeters = context.minimumQualifyingMeters();
        return records.stream()
            .filter(record -> record.distanceOrZero() >= minimumMeters)
            .collect(Collectors.toList());
    }

    /**
     * Lowest target-distance time across the records; the earliest record wins a tie.
     */
    public Optional<BestTime> bestTime(List<ActivityRecord> records, double targetDistanceKm) {
        BestTime best = null;
        for (ActivityRecord record : records) {
            ResolvedTime resolved = timeResolver.resolveDetailed(record, targetDistanceKm);
            if (best == null || resolved.getSeconds() < best.getSeconds()) {
                best = new BestTime(resolved.getSeconds(), resolved.getSource(), record);
            }
        }
        return Optional.ofNullable(best);
    }

    public double totalDistanceKm(List<ActivityRecord> records) {
        double totalMeters = 0.0;
        for (ActivityRecord record : records) {
            totalMeters += record.distanceOrZero();
        }
        return totalMeters / 1000.0;
    }

    /**
     * Record with the greatest distance; the earliest record wins a tie.
     */
    public Optional<ActivityRecord> longest(List<ActivityRecord> records) {
        ActivityRecord longest = null;
        for (ActivityRecord record : records) {
            if (longest == null || record.distanceOrZero() > longest.distanceOrZero()) {
                longest = record;
            }
        }
        return Optional.ofNullable(longest);
    }

    @Value
    public static class BestTime {
        long seconds;
        ResolvedTime.Source source;
        ActivityRecord record;
    }
}
