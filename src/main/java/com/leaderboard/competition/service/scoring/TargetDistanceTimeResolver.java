package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.SplitMap;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Estimates how long a record took to cover a target distance, so a 5K time can be recovered
 * from inside a longer run. Rules, first match wins:
 * <ol>
 *     <li>a split exactly at the target (whole-kilometer targets only)</li>
 *     <li>the nearest split below the target, extended at that split's average pace</li>
 *     <li>with no splits at all, the whole workout's average pace</li>
 *     <li>the record's total duration</li>
 * </ol>
 * Split-derived times never exceed the record's total duration.
 */
@Component
public class TargetDistanceTimeResolver {

    private final SplitExtractor splitExtractor;

    public TargetDistanceTimeResolver(SplitExtractor splitExtractor) {
        this.splitExtractor = splitExtractor;
    }

    public long resolve(ActivityRecord record, double targetDistanceKm) {
        return resolveDetailed(record, targetDistanceKm).getSeconds();
    }

    public ResolvedTime resolveDetailed(ActivityRecord record, double targetDistanceKm) {
        Objects.requireNonNull(record, "record");
        long duration = record.getDurationSeconds();
        SplitMap splits = splitExtractor.extract(record);

        if (splits.isEmpty()) {
            double distanceKm = record.distanceOrZero() / 1000.0;
            if (distanceKm > 0) {
                double pacePerKm = duration / distanceKm;
                return new ResolvedTime(Math.round(pacePerKm * targetDistanceKm), ResolvedTime.Source.AVERAGE_PACE);
            }
            return new ResolvedTime(duration, ResolvedTime.Source.TOTAL_DURATION);
        }

        if (isWholeKilometer(targetDistanceKm)) {
            OptionalLong exact = splits.at((int) targetDistanceKm);
            if (exact.isPresent()) {
                return new ResolvedTime(Math.min(exact.getAsLong(), duration), ResolvedTime.Source.EXACT_SPLIT);
            }
        }

        Map.Entry<Integer, Long> floor = splits.floor(targetDistanceKm);
        if (floor != null) {
            int mark = floor.getKey();
            long elapsed = floor.getValue();
            double pacePerKm = (double) elapsed / mark;
            double estimate = elapsed + pacePerKm * (targetDistanceKm - mark);
            return new ResolvedTime(Math.min(Math.round(estimate), duration), ResolvedTime.Source.INTERPOLATED_SPLIT);
        }

        // Splits exist but all lie beyond the target.
        return new ResolvedTime(duration, ResolvedTime.Source.TOTAL_DURATION);
    }

    private static boolean isWholeKilometer(double kilometers) {
        return kilometers >= 1 && kilometers <= Integer.MAX_VALUE && kilometers == Math.rint(kilometers);
    }
}
