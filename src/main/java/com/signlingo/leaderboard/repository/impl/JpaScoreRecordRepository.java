package com.signlingo.leaderboard.repository.impl;

import com.signlingo.leaderboard.model.ScoreRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaScoreRecordRepository extends JpaRepository<ScoreRecord, String> {

    @Query("select count(distinct s.score) from ScoreRecord s where s.score > :score")
    long countDistinctScoresGreaterThan(@Param("score") long score);
}
