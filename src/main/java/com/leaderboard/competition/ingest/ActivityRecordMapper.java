package com.leaderboard.competition.ingest;

import com.leaderboard.competition.dto.ActivityRecordRequest;
import com.leaderboard.competition.exception.InvalidRequestException;
import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.SplitAnnotation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts request bodies into engine records. Explicit splits and team win over the ones
 * carried in the event tags.
 */
public final class ActivityRecordMapper {

    private ActivityRecordMapper() {
    }

    public static ActivityRecord toRecord(ActivityRecordRequest request, String defaultParticipantId) {
        if (request == null) {
            throw new InvalidRequestException("Activity record cannot be null");
        }
        if (request.getDurationSeconds() == null || request.getDurationSeconds() < 0) {
            throw new InvalidRequestException("Duration must be a non-negative number of seconds for record " + request.getId());
        }
        List<SplitAnnotation> splits = request.getSplits() != null && !request.getSplits().isEmpty()
            ? request.getSplits()
            : WorkoutEventTags.splitAnnotations(request.getTags());
        String teamId = request.getTeamId() != null && !request.getTeamId().isBlank()
            ? request.getTeamId()
            : WorkoutEventTags.teamId(request.getTags()).orElse(null);
        String participantId = request.getParticipantId() != null && !request.getParticipantId().isBlank()
            ? request.getParticipantId()
            : defaultParticipantId;

        return ActivityRecord.builder()
            .id(request.getId())
            .participantId(participantId)
            .distanceMeters(request.getDistanceMeters())
            .durationSeconds(request.getDurationSeconds())
            .splitAnnotations(splits)
            .teamId(teamId)
            .build();
    }

    /**
     * Keeps the participants' order; each record defaults to the participant it is listed under.
     */
    public static Map<String, List<ActivityRecord>> toRecordsByParticipant(Map<String, List<ActivityRecordRequest>> requests) {
        if (requests == null) {
            throw new InvalidRequestException("Records cannot be null");
        }
        Map<String, List<ActivityRecord>> records = new LinkedHashMap<>();
        for (Map.Entry<String, List<ActivityRecordRequest>> entry : requests.entrySet()) {
            if (entry.getValue() == null) {
                throw new InvalidRequestException("Records for participant " + entry.getKey() + " cannot be null");
            }
            List<ActivityRecord> participantRecords = new ArrayList<>(entry.getValue().size());
            for (ActivityRecordRequest request : entry.getValue()) {
                participantRecords.add(toRecord(request, entry.getKey()));
            }
            records.put(entry.getKey(), participantRecords);
        }
        return records;
    }

    public static List<ActivityRecord> toRecords(List<ActivityRecordRequest> requests) {
        if (requests == null) {
            throw new InvalidRequestException("Records cannot be null");
        }
        List<ActivityRecord> records = new ArrayList<>(requests.size());
        for (ActivityRecordRequest request : requests) {
            records.add(toRecord(request, null));
        }
        return records;
    }
}
