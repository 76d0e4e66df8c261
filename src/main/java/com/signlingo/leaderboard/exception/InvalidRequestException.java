package com.signlingo.leaderboard.exception;

/**
 * Malformed paging arguments. Always raised before the store is touched.
 */
public class InvalidRequestException extends LeaderboardException {
    public InvalidRequestException(String message) {
        super(message, "INVALID_REQUEST");
    }
}
