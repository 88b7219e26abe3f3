package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ScoringMode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Display strings for scores. The exact shapes are consumed by existing clients and must not drift.
 */
public final class ScoreFormatter {

    public static final String NO_TIME = "--:--";

    private ScoreFormatter() {
    }

    /**
     * {@code M:SS} under one hour, {@code H:MM:SS} from one hour up.
     */
    public static String formatDuration(double seconds) {
        long total = seconds > 0 ? (long) Math.floor(seconds) : 0L;
        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long secs = total % 60;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", hours, minutes, secs);
        }
        return String.format(Locale.ROOT, "%d:%02d", minutes, secs);
    }

    /**
     * Two decimals below 10 km, one decimal from 10 km up. Rounds the exact binary value
     * half-up, so 9.995 (stored just below) renders as {@code 9.99 km}.
     */
    public static String formatDistance(double kilometers) {
        int scale = kilometers >= 10 ? 1 : 2;
        return new BigDecimal(kilometers).setScale(scale, RoundingMode.HALF_UP).toPlainString() + " km";
    }

    public static String formatWorkoutCount(int count) {
        return count + (count == 1 ? " workout" : " workouts");
    }

    public static String formatMemberCount(int count) {
        return count + (count == 1 ? " member" : " members");
    }

    /**
     * Formatted score for a roster member who has nothing on the board yet.
     */
    public static String placeholder(ScoringMode mode) {
        switch (mode) {
            case MOST_DISTANCE:
                return formatDistance(0);
            case PARTICIPATION:
                return formatWorkoutCount(0);
            case FASTEST_TIME:
            default:
                return NO_TIME;
        }
    }

    public static String formatTeamScore(double score, ScoringMode mode) {
        switch (mode) {
            case MOST_DISTANCE:
                return formatDistance(score);
            case PARTICIPATION:
                return formatMemberCount((int) score);
            case FASTEST_TIME:
            default:
                return score == 0 ? NO_TIME : formatDuration(score);
        }
    }
}
