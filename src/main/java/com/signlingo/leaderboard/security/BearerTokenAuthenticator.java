package com.signlingo.leaderboard.security;

/**
 * Resolves the caller behind an {@code Authorization} header.
 */
public interface BearerTokenAuthenticator {

    /**
     * @param authorizationHeader raw header value, possibly null
     * @return the verified user id
     * @throws com.signlingo.leaderboard.exception.UnauthorizedException if the credential is missing or invalid
     */
    String authenticate(String authorizationHeader);
}
