package com.signlingo.leaderboard.repository;

import com.signlingo.leaderboard.model.ScoreRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the score table. Implementations report failures as
 * {@link com.signlingo.leaderboard.exception.StoreException}.
 */
public interface ScoreStore {

    /**
     * Records ordered by score descending, then created_at ascending, then id ascending.
     * Returns fewer than {@code limit} rows at the end of the table and none past it.
     */
    List<ScoreRecord> fetchPage(long offset, int limit);

    Optional<ScoreRecord> fetchById(String id);

    /**
     * Number of distinct score values strictly greater than {@code score}
     * across the whole table.
     */
    long countDistinctScoresGreaterThan(long score);
}
