package com.signlingo.leaderboard.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A participant's ranking-relevant state. Written by the progress collaborator,
 * only ever read by the ranking engine.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_ranking_order", columnList = "score DESC,created_at ASC,id ASC"),
    @Index(name = "idx_users_score", columnList = "score")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreRecord {
    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Column(name = "username")
    private String username;

    @Column(name = "avatar")
    private String avatar;

    @Column(name = "score", nullable = false)
    private Long score;

    @Column(name = "created_at", nullable = false, updatable = false)
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant createdAt;

    /** A score that was never written counts as 0. */
    public Long getScore() {
        return score != null ? score : 0L;
    }
}
