package com.leaderboard.competition.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings under {@code leaderboard.scoring.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "leaderboard.scoring")
public class ScoringProperties {

    @DecimalMin(value = "0", inclusive = false, message = "Default target distance must be positive")
    private double defaultTargetDistanceKm = 5.0;

    @DecimalMin(value = "0", inclusive = false, message = "Qualifying ratio must be positive")
    @DecimalMax(value = "1", message = "Qualifying ratio cannot exceed 1")
    private double qualifyingRatio = 0.95;

    @Min(value = 1, message = "Parallel threshold must be at least 1")
    private int parallelThreshold = 256;

    private boolean restrictToKnownTeams = false;

    /** Team id to display name. */
    @NotNull
    private Map<String, String> teams = new LinkedHashMap<>();
}
