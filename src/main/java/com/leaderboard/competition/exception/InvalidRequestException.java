package com.leaderboard.competition.exception;

/**
 * Caller broke the contract of a scoring operation (missing records, bad target distance).
 * Distinct from an empty leaderboard, which is a valid result.
 */
public class InvalidRequestException extends LeaderboardException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
