package com.signlingo.leaderboard.exception;

/**
 * The score store was unreachable, timed out or reported a failure.
 * The message and cause are for logs only and never reach the client.
 */
public class StoreException extends LeaderboardException {
    public StoreException(String message) {
        super(message, "STORE_ERROR");
    }

    public StoreException(String message, Throwable cause) {
        super(message, "STORE_ERROR", cause);
    }
}
