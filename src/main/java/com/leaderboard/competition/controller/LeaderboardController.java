package com.leaderboard.competition.controller;

import com.leaderboard.competition.dto.BuildLeaderboardRequest;
import com.leaderboard.competition.dto.BuildTeamLeaderboardRequest;
import com.leaderboard.competition.dto.LeaderboardResponse;
import com.leaderboard.competition.dto.ScoringModeResponse;
import com.leaderboard.competition.dto.TeamLeaderboardResponse;
import com.leaderboard.competition.ingest.ActivityRecordMapper;
import com.leaderboard.competition.model.ActivityRecord;
import com.leaderboard.competition.model.DistanceUnit;
import com.leaderboard.competition.model.LeaderboardEntry;
import com.leaderboard.competition.model.ScoringMode;
import com.leaderboard.competition.model.TeamLeaderboardEntry;
import com.leaderboard.competition.service.LeaderboardService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/leaderboards")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    
    private final LeaderboardService leaderboardService;
    private final Clock clock;
    
    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService, Clock clock) {
        this.leaderboardService = leaderboardService;
        this.clock = clock;
    }
    
    /**
     * Score individual participants.
     * POST /api/v1/leaderboards/individual
     */
    @PostMapping("/individual")
    public ResponseEntity<LeaderboardResponse> buildLeaderboard(@Valid @RequestBody BuildLeaderboardRequest request) {
        
        logger.info("Received POST request to build leaderboard - mode: {}, participants: {}, roster: {}", 
            request.getMode(), request.getRecords().size(),
            request.getParticipants() == null ? 0 : request.getParticipants().size());
        
        try {
            Double targetKm = toKilometers(request.getTargetDistance(), request.getTargetDistanceUnit());
            Map<String, List<ActivityRecord>> records = ActivityRecordMapper.toRecordsByParticipant(request.getRecords());
            List<LeaderboardEntry> entries = leaderboardService.buildLeaderboard(
                records, request.getMode(), targetKm, request.getParticipants());
            
            LeaderboardResponse response = LeaderboardResponse.builder()
                .mode(request.getMode())
                .targetDistanceKm(reportedTarget(request.getMode(), targetKm))
                .entries(entries)
                .totalEntries(entries.size())
                .computedAt(Instant.now(clock))
                .build();
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.warn("Error building leaderboard - mode: {}, error: {}", request.getMode(), e.getMessage());
            throw e;
        }
    }
    
    /**
     * Aggregate team-tagged records into team standings.
     * POST /api/v1/leaderboards/teams
     */
    @PostMapping("/teams")
    public ResponseEntity<TeamLeaderboardResponse> buildTeamLeaderboard(
            @Valid @RequestBody BuildTeamLeaderboardRequest request) {
        
        logger.info("Received POST request to build team leaderboard - mode: {}, records: {}", 
            request.getMode(), request.getRecords().size());
        
        try {
            Double targetKm = toKilometers(request.getTargetDistance(), request.getTargetDistanceUnit());
            List<ActivityRecord> records = ActivityRecordMapper.toRecords(request.getRecords());
            List<TeamLeaderboardEntry> teams = leaderboardService.buildTeamLeaderboard(
                records, request.getMode(), targetKm);
            
            TeamLeaderboardResponse response = TeamLeaderboardResponse.builder()
                .mode(request.getMode())
                .targetDistanceKm(reportedTarget(request.getMode(), targetKm))
                .teams(teams)
                .totalTeams(teams.size())
                .computedAt(Instant.now(clock))
                .build();
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.warn("Error building team leaderboard - mode: {}, error: {}", request.getMode(), e.getMessage());
            throw e;
        }
    }
    
    /**
     * Labels and descriptions for every scoring mode.
     * GET /api/v1/leaderboards/scoring-modes
     */
    @GetMapping("/scoring-modes")
    public ResponseEntity<List<ScoringModeResponse>> getScoringModes() {
        List<ScoringModeResponse> modes = Arrays.stream(ScoringMode.values())
            .map(ScoringModeResponse::from)
            .toList();
        return ResponseEntity.ok(modes);
    }
    
    private Double toKilometers(Double targetDistance, DistanceUnit unit) {
        if (targetDistance == null) {
            return null;
        }
        return (unit == null ? DistanceUnit.KILOMETERS : unit).toKilometers(targetDistance);
    }
    
    private Double reportedTarget(ScoringMode mode, Double targetKm) {
        return mode.requiresTargetDistance() ? leaderboardService.effectiveTargetDistanceKm(targetKm) : null;
    }
}
