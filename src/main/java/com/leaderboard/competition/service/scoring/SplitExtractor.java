package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.SplitAnnotation;
import com.leaderboard.competition.model.SplitMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Turns a record's split annotations into a {@link SplitMap}. Annotations are read in their
 * given order; a repeated mark keeps the last value seen. Entries with a non-positive mark,
 * an unparsable time or a zero time are dropped.
 */
@Component
public class SplitExtractor {

    private static final Logger logger = LoggerFactory.getLogger(SplitExtractor.class);
    private static final Pattern MARK = Pattern.compile("\\d{1,9}");

    public SplitMap extract(ActivityRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.getSplitAnnotations() == null || record.getSplitAnnotations().isEmpty()) {
            return SplitMap.empty();
        }

        Map<Integer, Long> byMark = new LinkedHashMap<>();
        for (SplitAnnotation annotation : record.getSplitAnnotations()) {
            if (annotation == null) {
                continue;
            }
            OptionalInt mark = parseMark(annotation.getKilometerMark());
            OptionalLong elapsed = DurationParser.parse(annotation.getElapsed());
            if (mark.isEmpty() || elapsed.isEmpty() || elapsed.getAsLong() <= 0) {
                logger.debug("Dropping split annotation {} on record {}", annotation, record.getId());
                continue;
            }
            byMark.put(mark.getAsInt(), elapsed.getAsLong());
        }

        SplitMap splits = SplitMap.of(byMark);
        if (splits.size() < byMark.size()) {
            logger.debug("Dropped {} non-monotonic splits on record {}", byMark.size() - splits.size(), record.getId());
        }
        return splits;
    }

    private OptionalInt parseMark(String kilometerMark) {
        if (kilometerMark == null) {
            return OptionalInt.empty();
        }
        String trimmed = kilometerMark.trim();
        if (!MARK.matcher(trimmed).matches()) {
            return OptionalInt.empty();
        }
        int mark = Integer.parseInt(trimmed);
        return mark > 0 ? OptionalInt.of(mark) : OptionalInt.empty();
    }
}
