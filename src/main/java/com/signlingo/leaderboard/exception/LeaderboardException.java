package com.signlingo.leaderboard.exception;

/**
 * Base of the service's error kinds. The error code is the stable,
 * client-visible identifier written into every error response.
 */
public class LeaderboardException extends RuntimeException {
    private final String errorCode;

    public LeaderboardException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public LeaderboardException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
