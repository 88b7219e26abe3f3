package com.leaderboard.competition.service.scoring;

import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parses elapsed-time strings of the form {@code H:MM:SS} or {@code M:SS} into seconds.
 * Segment widths are not fixed ({@code 1:5:3} is accepted).
 */
public final class DurationParser {

    private static final Pattern SEGMENT = Pattern.compile("\\d{1,9}");

    private DurationParser() {
    }

    /**
     * @return total seconds, or empty when the string is not a two- or three-segment
     *         colon-separated list of non-negative integers
     */
    public static OptionalLong parse(String duration) {
        if (duration == null) {
            return OptionalLong.empty();
        }
        String[] parts = duration.trim().split(":", -1);
        if (parts.length != 2 && parts.length != 3) {
            return OptionalLong.empty();
        }
        long total = 0L;
        for (String part : parts) {
            String segment = part.trim();
            if (!SEGMENT.matcher(segment).matches()) {
                return OptionalLong.empty();
            }
            total = total * 60 + Long.parseLong(segment);
        }
        return OptionalLong.of(total);
    }

    /**
     * Same as {@link #parse(String)} but reports unparsable input as {@code 0}.
     * Callers must not read {@code 0} as a genuine zero duration.
     */
    public static long parseOrZero(String duration) {
        return parse(duration).orElse(0L);
    }
}
