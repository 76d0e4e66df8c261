package com.signlingo.leaderboard.repository.impl;

import com.signlingo.leaderboard.exception.StoreException;
import com.signlingo.leaderboard.model.ScoreRecord;
import com.signlingo.leaderboard.repository.ScoreStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Optional;

/**
 * Relational score store. The distinct-higher count runs as a
 * {@code COUNT(DISTINCT score)} aggregate inside the database.
 * <p>
 * Not transactional itself: each read is a single statement, and a failure to
 * obtain a connection surfaces inside the method as a {@link TransactionException}
 * from the Spring Data repository or a {@link PersistenceException} from Hibernate.
 */
@Repository
@ConditionalOnProperty(name = "leaderboard.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaScoreStore implements ScoreStore {

    static final String RANKING_ORDER_QUERY =
        "select s from ScoreRecord s order by s.score desc, s.createdAt asc, s.id asc";

    private final JpaScoreRecordRepository jpaRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Autowired
    public JpaScoreStore(JpaScoreRecordRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public List<ScoreRecord> fetchPage(long offset, int limit) {
        if (offset > Integer.MAX_VALUE) {
            // past what JPA can address, treated as past the end of the table
            return List.of();
        }
        try {
            return entityManager.createQuery(RANKING_ORDER_QUERY, ScoreRecord.class)
                .setFirstResult((int) offset)
                .setMaxResults(limit)
                .getResultList();
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new StoreException("Failed to fetch score page at offset " + offset, e);
        }
    }

    @Override
    public Optional<ScoreRecord> fetchById(String id) {
        try {
            return jpaRepository.findById(id);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new StoreException("Failed to fetch score record " + id, e);
        }
    }

    @Override
    public long countDistinctScoresGreaterThan(long score) {
        try {
            return jpaRepository.countDistinctScoresGreaterThan(score);
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            throw new StoreException("Failed to count distinct scores above " + score, e);
        }
    }
}
