package com.signlingo.leaderboard.security;

import com.signlingo.leaderboard.exception.LeaderboardException;
import com.signlingo.leaderboard.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Verifies HS256 access tokens signed with the identity provider's shared secret
 * and returns their {@code sub} claim.
 */
@Component
public class JwtBearerTokenAuthenticator implements BearerTokenAuthenticator {

    private static final Logger logger = LoggerFactory.getLogger(JwtBearerTokenAuthenticator.class);

    private static final String BEARER_PREFIX = "Bearer ";

    @Value("${auth.jwt.secret:}")
    private String secret;

    @Value("${auth.jwt.audience:authenticated}")
    private String audience;

    private JwtParser parser;

    public JwtBearerTokenAuthenticator() {
    }

    JwtBearerTokenAuthenticator(String secret, String audience) {
        this.secret = secret;
        this.audience = audience;
        init();
    }

    @PostConstruct
    public void init() {
        if (secret == null || secret.isBlank()) {
            logger.warn("auth.jwt.secret is not set, authenticated endpoints will fail");
            return;
        }
        parser = Jwts.parser()
            .verifyWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
            .requireAudience(audience)
            .build();
    }

    @Override
    public String authenticate(String authorizationHeader) {
        if (parser == null) {
            throw new LeaderboardException("JWT secret not configured", "AUTH_NOT_CONFIGURED");
        }

        String token = extractToken(authorizationHeader);
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            String userId = claims.getSubject();
            if (userId == null || userId.isBlank()) {
                throw new UnauthorizedException("Invalid token payload");
            }
            return userId;
        } catch (JwtException | IllegalArgumentException e) {
            logger.debug("Rejected bearer token: {}", e.getMessage());
            throw new UnauthorizedException("Invalid or expired token", e);
        }
    }

    private String extractToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            throw new UnauthorizedException("Not authenticated");
        }
        if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new UnauthorizedException("Authorization scheme must be Bearer");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty()) {
            throw new UnauthorizedException("Not authenticated");
        }
        return token;
    }
}
