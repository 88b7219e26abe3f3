package com.leaderboard.competition.ingest;

import com.leaderboard.competition.dto.ActivityRecordRequest;
import com.leaderboard.competition.exception.InvalidRequestException;
import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.SplitAnnotation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActivityRecordMapperTest {

    @Test
    void testToRecord_ReadsSplitsAndTeamFromTags() {
        // Arrange
        ActivityRecordRequest request = ActivityRecordRequest.builder()
            .id("w1")
            .distanceMeters(5200.0)
            .durationSeconds(1600L)
            .tags(List.of(List.of("split", "5", "00:25:30"), List.of("team", "red")))
            .build();

        // Act
        ActivityRecord record = ActivityRecordMapper.toRecord(request, "alice");

        // Assert
        assertEquals("w1", record.getId());
        assertEquals("alice", record.getParticipantId());
        assertEquals("red", record.getTeamId());
        assertEquals(List.of(new SplitAnnotation("5", "00:25:30")), record.getSplitAnnotations());
        assertEquals(1600L, record.getDurationSeconds());
    }

    @Test
    void testToRecord_ExplicitFieldsOverrideTags() {
        // Arrange
        ActivityRecordRequest request = ActivityRecordRequest.builder()
            .id("w1")
            .participantId("bob")
            .durationSeconds(1600L)
            .splits(List.of(SplitAnnotation.of(5, "24:00")))
            .teamId("blue")
            .tags(List.of(List.of("split", "5", "00:25:30"), List.of("team", "red")))
            .build();

        // Act
        ActivityRecord record = ActivityRecordMapper.toRecord(request, "alice");

        // Assert
        assertEquals("bob", record.getParticipantId());
        assertEquals("blue", record.getTeamId());
        assertEquals(List.of(SplitAnnotation.of(5, "24:00")), record.getSplitAnnotations());
    }

    @Test
    void testToRecord_MissingDistanceStaysNull() {
        ActivityRecordRequest request = ActivityRecordRequest.builder().id("w1").durationSeconds(600L).build();

        ActivityRecord record = ActivityRecordMapper.toRecord(request, "alice");

        assertNull(record.getDistanceMeters());
        assertEquals(0.0, record.distanceOrZero());
        assertFalse(record.hasTeam());
    }

    @Test
    void testToRecord_InvalidDuration() {
        ActivityRecordRequest missing = ActivityRecordRequest.builder().id("w1").build();
        ActivityRecordRequest negative = ActivityRecordRequest.builder().id("w2").durationSeconds(-1L).build();

        assertThrows(InvalidRequestException.class, () -> ActivityRecordMapper.toRecord(missing, "alice"));
        assertThrows(InvalidRequestException.class, () -> ActivityRecordMapper.toRecord(negative, "alice"));
        assertThrows(InvalidRequestException.class, () -> ActivityRecordMapper.toRecord(null, "alice"));
    }

    @Test
    void testToRecordsByParticipant_KeepsOrder() {
        // Arrange
        Map<String, List<ActivityRecordRequest>> requests = new LinkedHashMap<>();
        requests.put("zed", List.of(ActivityRecordRequest.builder().id("z1").durationSeconds(60L).build()));
        requests.put("amy", new ArrayList<>());

        // Act
        Map<String, List<ActivityRecord>> records = ActivityRecordMapper.toRecordsByParticipant(requests);

        // Assert
        assertEquals(List.of("zed", "amy"), new ArrayList<>(records.keySet()));
        assertEquals("zed", records.get("zed").get(0).getParticipantId());
        assertTrue(records.get("amy").isEmpty());
    }

    @Test
    void testToRecordsByParticipant_NullListRejected() {
        Map<String, List<ActivityRecordRequest>> requests = new LinkedHashMap<>();
        requests.put("amy", null);

        assertThrows(InvalidRequestException.class, () -> ActivityRecordMapper.toRecordsByParticipant(requests));
        assertThrows(InvalidRequestException.class, () -> ActivityRecordMapper.toRecords(null));
    }
}
