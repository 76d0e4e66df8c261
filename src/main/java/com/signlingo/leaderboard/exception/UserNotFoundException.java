package com.signlingo.leaderboard.exception;

public class UserNotFoundException extends LeaderboardException {
    public UserNotFoundException(String message) {
        super(message, "USER_NOT_FOUND");
    }
}
