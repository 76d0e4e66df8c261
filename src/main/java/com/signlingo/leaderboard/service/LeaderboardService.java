package com.signlingo.leaderboard.service;

import com.signlingo.leaderboard.exception.InvalidRequestException;
import com.signlingo.leaderboard.exception.UserNotFoundException;
import com.signlingo.leaderboard.model.RankedEntry;
import com.signlingo.leaderboard.model.ScoreRecord;
import com.signlingo.leaderboard.repository.ScoreStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dense-rank leaderboard reads. Stateless: every call goes to the store, and
 * store failures propagate as {@link com.signlingo.leaderboard.exception.StoreException}
 * without retries.
 * <p>
 * The page fetch and the distinct-higher count are separate queries, so a score
 * that changes between them can yield a momentarily stale position.
 */
@Service
public class LeaderboardService {
    
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardService.class);

    public static final int MAX_PAGE_SIZE = 100;
    
    private final ScoreStore scoreStore;
    
    @Autowired
    public LeaderboardService(ScoreStore scoreStore) {
        this.scoreStore = scoreStore;
    }
    
    /**
     * Get one page of the leaderboard, best score first, with dense-rank positions.
     * A page past the end of the table is empty rather than an error.
     */
    public List<RankedEntry> getLeaderboardPage(int page, int pageSize) {
        validatePageRequest(page, pageSize);
        long offset = (long) (page - 1) * pageSize;

        List<ScoreRecord> rows = scoreStore.fetchPage(offset, pageSize);
        if (rows.isEmpty()) {
            logger.debug("No rows at offset {} (page {}, pageSize {})", offset, page, pageSize);
            return List.of();
        }

        long topScore = DenseRanking.topScore(rows);
        long distinctHigher = scoreStore.countDistinctScoresGreaterThan(topScore);
        logger.debug("Page {} (pageSize {}): {} rows, top score {}, {} distinct higher scores",
            page, pageSize, rows.size(), topScore, distinctHigher);

        return DenseRanking.rankPage(rows, distinctHigher);
    }
    
    private void validatePageRequest(int page, int pageSize) {
        if (page < 1) {
            throw new InvalidRequestException("Page must be greater than or equal to 1");
        }
        if (pageSize < 1) {
            throw new InvalidRequestException("Page size must be greater than 0");
        }
        if (pageSize > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("Page size cannot exceed " + MAX_PAGE_SIZE);
        }
    }
    
    /**
     * Get the dense-rank position of a single user.
     */
    public RankedEntry getUserRank(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidRequestException("UserId cannot be null or empty");
        }

        ScoreRecord record = scoreStore.fetchById(userId)
            .orElseThrow(() -> new UserNotFoundException("User not found: " + userId));

        long distinctHigher = scoreStore.countDistinctScoresGreaterThan(record.getScore());
        long position = DenseRanking.positionAfter(distinctHigher);
        logger.debug("User {} with score {} is at position {}", userId, record.getScore(), position);

        return RankedEntry.of(record, position);
    }
}
