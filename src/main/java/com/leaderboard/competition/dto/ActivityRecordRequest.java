package com.leaderboard.competition.dto;

import com.leaderboard.competition.model.SplitAnnotation;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityRecordRequest {
    private String id;
    private String participantId;

    @PositiveOrZero(message = "Distance cannot be negative")
    private Double distanceMeters;

    @NotNull(message = "Duration cannot be null")
    @PositiveOrZero(message = "Duration cannot be negative")
    private Long durationSeconds;

    private List<SplitAnnotation> splits;

    /** Raw event tags, e.g. {@code ["split", "5", "00:25:30"]} or {@code ["team", "<id>"]}. */
    private List<List<String>> tags;

    private String teamId;
}
