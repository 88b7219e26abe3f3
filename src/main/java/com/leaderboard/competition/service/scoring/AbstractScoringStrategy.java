package com.leaderboard.competition.service.scoring;

import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.LeaderboardEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scores participants independently (fanned out over a parallel stream when the context asks
 * for it), then sorts the collected entries. Collection keeps the map's iteration order and the
 * sort is stable, so equal scores stay in input order.
 */
public abstract class AbstractScoringStrategy implements ScoringStrategy {

    @Override
    public final List<LeaderboardEntry> score(Map<String, List<ActivityRecord>> recordsByParticipant,
                                              ScoringContext context) {
        Objects.requireNonNull(recordsByParticipant, "recordsByParticipant");
        Objects.requireNonNull(context, "context");

        Collection<Map.Entry<String, List<ActivityRecord>>> participants = recordsByParticipant.entrySet();
        Stream<Map.Entry<String, List<ActivityRecord>>> stream =
            context.isParallel() ? participants.parallelStream() : participants.stream();

        List<LeaderboardEntry> entries = new ArrayList<>(stream
            .map(entry -> scoreParticipant(
                entry.getKey(),
                Objects.requireNonNull(entry.getValue(), () -> "records for participant " + entry.getKey()),
                context))
            .flatMap(Optional::stream)
            .collect(Collectors.toList()));

        entries.sort(ordering());
        return List.copyOf(entries);
    }

    /**
     * @return the participant's entry, or empty when the participant does not qualify
     */
    protected abstract Optional<LeaderboardEntry> scoreParticipant(String participantId,
                                                                   List<ActivityRecord> records,
                                                                   ScoringContext context);

    protected abstract Comparator<LeaderboardEntry> ordering();
}
