package com.signlingo.leaderboard.controller;

import com.signlingo.leaderboard.dto.LeaderboardPageResponse;
import com.signlingo.leaderboard.model.RankedEntry;
import com.signlingo.leaderboard.security.BearerTokenAuthenticator;
import com.signlingo.leaderboard.service.LeaderboardService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    
    private final LeaderboardService leaderboardService;
    private final BearerTokenAuthenticator authenticator;
    
    @Autowired
    public LeaderboardController(LeaderboardService leaderboardService, BearerTokenAuthenticator authenticator) {
        this.leaderboardService = leaderboardService;
        this.authenticator = authenticator;
    }
    
    /**
     * Get one page of the leaderboard with dense ranks.
     * GET /api/leaderboard?page=1&page_size=10
     */
    @GetMapping
    public ResponseEntity<LeaderboardPageResponse> getLeaderboard(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "page_size", defaultValue = "10") int pageSize) {
        
        logger.info("Received GET request for leaderboard page - page: {}, pageSize: {}", page, pageSize);
        
        try {
            List<RankedEntry> items = leaderboardService.getLeaderboardPage(page, pageSize);
            
            LeaderboardPageResponse response = LeaderboardPageResponse.builder()
                .items(items)
                .page(page)
                .pageSize(pageSize)
                .build();
            
            logger.info("Successfully retrieved leaderboard page - page: {}, pageSize: {}, returnedUsers: {}", 
                page, pageSize, items.size());
            
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Error retrieving leaderboard page - page: {}, pageSize: {}, error: {}", 
                page, pageSize, e.getMessage());
            throw e;
        }
    }
    
    /**
     * Get the dense rank of the authenticated caller.
     * GET /api/leaderboard/my-rank
     */
    @GetMapping("/my-rank")
    public ResponseEntity<RankedEntry> getMyRank(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        
        String userId = authenticator.authenticate(authorization);
        logger.info("Received GET request for rank - userId: {}", userId);
        
        try {
            RankedEntry entry = leaderboardService.getUserRank(userId);
            
            logger.info("Successfully retrieved rank - userId: {}, score: {}, position: {}", 
                userId, entry.getScore(), entry.getPosition());
            
            return ResponseEntity.ok(entry);
        } catch (Exception e) {
            logger.error("Error retrieving rank - userId: {}, error: {}", userId, e.getMessage());
            throw e;
        }
    }
}
